package com.visualcompiler.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A vertex of a visual program: one block placed on the canvas.
 *
 * <p>Every node gets a random identifier at construction which stays stable for its
 * lifetime. Outgoing connections reference other nodes of the same graph; a node never
 * owns the nodes it points to.
 *
 * <p>Nodes of a block kind ({@link NodeKind#isBlock()}) read their flow connections as
 * their body and may carry a single {@linkplain #next() successor} that follows the
 * closed block.
 *
 * <p>Nodes are not thread-safe. A graph and its nodes belong to a single compile request.
 */
public final class Node {

    private final String id;
    private final NodeKind kind;
    private final Position position;
    private final List<Node> connections = new ArrayList<>();
    private NodeProperties properties;
    private Node next;

    /**
     * Creates a node with a freshly generated identifier.
     *
     * @param kind node kind
     * @param position canvas position, origin when null
     * @param properties payload matching {@code kind}
     * @throws IllegalArgumentException if the payload type does not match the kind
     */
    public Node(NodeKind kind, Position position, NodeProperties properties) {
        this.id = UUID.randomUUID().toString();
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.position = position == null ? Position.origin() : position;
        this.properties = requireMatching(kind, properties);
    }

    public String id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public Position position() {
        return position;
    }

    public NodeProperties properties() {
        return properties;
    }

    /**
     * Returns the payload cast to the type its kind dictates.
     *
     * @param type expected payload type
     * @param <P> payload type
     * @return typed payload
     * @throws ClassCastException if {@code type} does not belong to this node's kind
     */
    public <P extends NodeProperties> P properties(Class<P> type) {
        return type.cast(properties);
    }

    /**
     * Replaces the payload with one of the same kind.
     *
     * @param properties new payload
     * @throws IllegalArgumentException if the payload type does not match the kind
     */
    public void replaceProperties(NodeProperties properties) {
        this.properties = requireMatching(kind, properties);
    }

    /**
     * Returns outgoing flow connections in insertion order.
     *
     * @return unmodifiable view of connected nodes
     */
    public List<Node> connections() {
        return Collections.unmodifiableList(connections);
    }

    /**
     * Appends a flow connection. Self loops and duplicate targets are ignored.
     *
     * @param target node to connect to
     * @return true if a new edge was added
     */
    public boolean connectTo(Node target) {
        Objects.requireNonNull(target, "target must not be null");
        if (target == this || target.id.equals(id) || connections.contains(target)) {
            return false;
        }
        connections.add(target);
        return true;
    }

    /**
     * Returns the statement that follows this block once it closes.
     *
     * @return successor, empty when none was connected
     */
    public Optional<Node> next() {
        return Optional.ofNullable(next);
    }

    /**
     * Sets the successor of a block node. The first successor wins.
     *
     * @param target successor node
     * @return true if the successor was set
     */
    public boolean setNext(Node target) {
        Objects.requireNonNull(target, "target must not be null");
        if (next != null || target == this) {
            return false;
        }
        next = target;
        return true;
    }

    /**
     * Checks this node's required properties.
     *
     * @return structural error messages, empty when valid
     */
    public List<String> validate() {
        return properties.validate();
    }

    @Override
    public String toString() {
        return kind.id() + "[" + id + "]";
    }

    private static NodeProperties requireMatching(NodeKind kind, NodeProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Class<? extends NodeProperties> expected = payloadType(kind);
        if (!expected.isInstance(properties)) {
            throw new IllegalArgumentException(
                "Node kind " + kind + " requires " + expected.getSimpleName()
                    + " but got " + properties.getClass().getSimpleName());
        }
        return properties;
    }

    /**
     * Returns the payload type nodes of the given kind carry.
     *
     * @param kind node kind
     * @return payload record type
     */
    public static Class<? extends NodeProperties> payloadType(NodeKind kind) {
        return switch (kind) {
            case START, END -> NoProperties.class;
            case VARIABLE -> VariableProperties.class;
            case PRINT -> PrintProperties.class;
            case INPUT -> InputProperties.class;
            case ASSIGN -> AssignProperties.class;
            case IF -> IfProperties.class;
            case WHILE -> WhileProperties.class;
            case FOR -> ForProperties.class;
        };
    }
}
