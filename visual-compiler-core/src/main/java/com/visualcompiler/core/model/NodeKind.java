package com.visualcompiler.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of blocks a visual program can be assembled from.
 *
 * <p>Each kind is identified on the wire by a lowercase id ({@code "start"},
 * {@code "variable"}, ...). The id is what editors send in block descriptors.
 */
public enum NodeKind {
    /** Program entry point */
    START("start"),

    /** Program exit point */
    END("end"),

    /** Variable declaration with optional initial value */
    VARIABLE("variable"),

    /** Console output of literal text and variables */
    PRINT("print"),

    /** Console input into a variable */
    INPUT("input"),

    /** Assignment of a verbatim expression to a variable */
    ASSIGN("assign"),

    /** Conditional block */
    IF("if"),

    /** Condition-controlled loop */
    WHILE("while"),

    /** C-style counted loop */
    FOR("for");

    private final String id;

    NodeKind(String id) {
        this.id = id;
    }

    /**
     * Returns the wire identifier of this kind.
     *
     * @return lowercase kind id
     */
    public String id() {
        return id;
    }

    /**
     * Whether nodes of this kind own a body (their flow connections) and may carry
     * a successor edge emitted after the block closes.
     *
     * @return true for IF, WHILE and FOR
     */
    public boolean isBlock() {
        return this == IF || this == WHILE || this == FOR;
    }

    /**
     * Resolves a kind from its wire identifier.
     *
     * @param id kind id, case-insensitive; may be null
     * @return matching kind, or empty for unknown ids
     */
    public static Optional<NodeKind> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(kind -> kind.id.equals(normalized))
            .findFirst();
    }
}
