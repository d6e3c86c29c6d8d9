package com.visualcompiler.core.graph;

/**
 * Result of adding a node to a {@link ProgramGraph}.
 */
public enum AddOutcome {
    /** Node stored */
    ADDED,

    /** Node stored, but the graph already had a Start node which stays the entry point */
    DUPLICATE_START,

    /** Node stored, but the graph already had an End node which stays the exit point */
    DUPLICATE_END,

    /** A node with the same identifier is already present; nothing changed */
    DUPLICATE_ID
}
