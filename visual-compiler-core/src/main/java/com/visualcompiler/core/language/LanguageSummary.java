package com.visualcompiler.core.language;

/**
 * Identifier and display name of a supported language.
 *
 * @param id language id such as {@code "cpp"}
 * @param name display name such as {@code "C++"}
 */
public record LanguageSummary(String id, String name) {
}
