package com.visualcompiler.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Abstract data types a Variable block can declare.
 *
 * <p>Target languages map these names to their own type spellings via
 * {@link com.visualcompiler.core.language.LanguageConfig#dataTypes()}.
 */
public enum DataType {
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BOOLEAN("boolean"),
    ARRAY("array");

    private final String id;

    DataType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a data type from its name, falling back to {@link #INT} for
     * null or unrecognized names.
     *
     * @param id type name such as {@code "float"}
     * @return resolved data type, never null
     */
    public static DataType fromIdOrDefault(String id) {
        if (id == null) {
            return INT;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.id.equals(normalized))
            .findFirst()
            .orElse(INT);
    }
}
