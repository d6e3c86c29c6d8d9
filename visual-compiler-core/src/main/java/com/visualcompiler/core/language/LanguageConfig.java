package com.visualcompiler.core.language;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static description of a target language.
 *
 * <p>Besides the informational data (display name, extension, keywords), the record holds
 * everything the code generator needs to lower a graph: the type spelling for each
 * abstract data type, statement templates with {@code {slot}} placeholders, and the
 * program skeleton around the generated statements.
 *
 * <p>The skeleton is emitted as: {@code preamble}, then each {@code scopeOpeners} line
 * (each one indents what follows), then {@code entryStatements}, the program body,
 * {@code exitStatements}, and finally one closing line per scope opener.
 *
 * @param name display name
 * @param extension source file extension including the dot
 * @param keywords reserved words (informational)
 * @param dataTypes abstract data type name to concrete type spelling
 * @param syntax statement template slot name to template
 * @param preamble header lines such as includes and imports
 * @param scopeOpeners templates of lines opening the class/main scopes
 * @param entryStatements statements emitted at the start of the main scope
 * @param exitStatements statements emitted at the end of the main scope
 * @param commentPrefix line comment marker
 * @param blockStyle how blocks are delimited
 * @param ioStyle console I/O idiom
 * @param trueLiteral boolean true literal
 * @param falseLiteral boolean false literal
 * @param arrayOpen opening delimiter of array literals
 * @param arrayClose closing delimiter of array literals
 * @param countedLoops whether {@code for} loops are counted ranges rather than C-style triples
 */
public record LanguageConfig(
    String name,
    String extension,
    List<String> keywords,
    Map<String, String> dataTypes,
    Map<String, String> syntax,
    List<String> preamble,
    List<String> scopeOpeners,
    List<String> entryStatements,
    List<String> exitStatements,
    String commentPrefix,
    BlockStyle blockStyle,
    IoStyle ioStyle,
    String trueLiteral,
    String falseLiteral,
    String arrayOpen,
    String arrayClose,
    boolean countedLoops
) {

    private static final Pattern SLOT = Pattern.compile("\\{(\\w+)}");

    /**
     * Compact constructor with validation.
     */
    public LanguageConfig {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(extension, "extension must not be null");
        Objects.requireNonNull(blockStyle, "blockStyle must not be null");
        Objects.requireNonNull(ioStyle, "ioStyle must not be null");
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        dataTypes = dataTypes == null ? Map.of() : Map.copyOf(dataTypes);
        syntax = syntax == null ? Map.of() : Map.copyOf(syntax);
        preamble = preamble == null ? List.of() : List.copyOf(preamble);
        scopeOpeners = scopeOpeners == null ? List.of() : List.copyOf(scopeOpeners);
        entryStatements = entryStatements == null ? List.of() : List.copyOf(entryStatements);
        exitStatements = exitStatements == null ? List.of() : List.copyOf(exitStatements);
        commentPrefix = commentPrefix == null ? "//" : commentPrefix;
    }

    /**
     * Returns the concrete spelling of an abstract data type.
     *
     * @param dataType abstract type name such as {@code "string"}
     * @return concrete type, or the spelling of {@code int} when unknown
     */
    public String typeFor(String dataType) {
        return dataTypes.getOrDefault(dataType, dataTypes.getOrDefault("int", "int"));
    }

    /**
     * Returns the statement terminator.
     *
     * @return terminator, empty for languages without one
     */
    public String statementEnd() {
        return syntax.getOrDefault("statement_end", "");
    }

    /**
     * Returns the raw template of a syntax slot.
     *
     * @param slot slot name such as {@code "if"}
     * @return template, empty when the language has no such slot
     */
    public String template(String slot) {
        return syntax.getOrDefault(slot, "");
    }

    /**
     * Fills a syntax slot's template. Placeholders without a value are left as they are.
     *
     * @param slot slot name such as {@code "while"}
     * @param values placeholder values
     * @return rendered template
     */
    public String render(String slot, Map<String, String> values) {
        return fill(template(slot), values);
    }

    /**
     * Replaces {@code {name}} placeholders in a template in a single pass, so values that
     * themselves contain braces are inserted literally.
     *
     * @param template template text
     * @param values placeholder values
     * @return filled template
     */
    public static String fill(String template, Map<String, String> values) {
        Matcher matcher = SLOT.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
