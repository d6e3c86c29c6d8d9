package com.visualcompiler.core.language;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages visual programs can be lowered to.
 */
public enum TargetLanguage {
    C("c"),
    CPP("cpp"),
    PYTHON("python"),
    JAVA("java");

    private final String id;

    TargetLanguage(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier callers use to select this language.
     *
     * @return lowercase language id
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a language from its identifier.
     *
     * @param id language id, case-insensitive; may be null
     * @return matching language, or empty when unsupported
     */
    public static Optional<TargetLanguage> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(language -> language.id.equals(normalized))
            .findFirst();
    }
}
