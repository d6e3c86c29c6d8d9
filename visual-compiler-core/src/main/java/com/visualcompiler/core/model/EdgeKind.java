package com.visualcompiler.core.model;

import java.util.Locale;

/**
 * Kinds of directed connections between nodes.
 */
public enum EdgeKind {
    /** Execution order; for IF/WHILE/FOR nodes, membership in the block body */
    FLOW,

    /** Statement that follows an IF/WHILE/FOR block once it closes */
    NEXT;

    /**
     * Resolves an edge kind from its wire name. Null, blank and unknown names map to
     * {@link #FLOW}, which is how unlabeled connections have always been read.
     *
     * @param name wire name such as {@code "next"}
     * @return resolved edge kind
     */
    public static EdgeKind fromNameOrDefault(String name) {
        if (name != null && "next".equals(name.trim().toLowerCase(Locale.ROOT))) {
            return NEXT;
        }
        return FLOW;
    }
}
