package com.visualcompiler.core.graph;

import com.visualcompiler.core.model.EdgeKind;
import com.visualcompiler.core.model.Node;
import com.visualcompiler.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Container of all nodes of one visual program and the connections between them.
 *
 * <p>The graph keeps nodes in insertion order, tracks one Start node (the traversal
 * anchor) and one End node, and exposes structural validation and warnings. Missing
 * Start/End nodes are only warned about so that program fragments can still be
 * compiled. A second Start or End node is a structural error.
 *
 * <p>A graph is built for a single compile request and then discarded. It is not
 * thread-safe.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProgramGraph graph = new ProgramGraph();
 * graph.addNode(start);
 * graph.addNode(print);
 * graph.connect(start.id(), print.id());
 *
 * List<String> errors = graph.validate();
 * List<String> warnings = graph.warnings();
 * }</pre>
 */
public class ProgramGraph {

    private static final Logger log = LoggerFactory.getLogger(ProgramGraph.class);

    static final String MISSING_START_WARNING =
        "Consider adding a start node to define the program entry point";
    static final String MISSING_END_WARNING =
        "Consider adding an end node to define the program exit point";
    static final String DUPLICATE_START_ERROR = "Program can only have one Start block";
    static final String DUPLICATE_END_ERROR = "Program can only have one End block";

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private Node startNode;
    private Node endNode;
    private int extraStartNodes;
    private int extraEndNodes;

    /**
     * Adds a node.
     *
     * <p>The first Start and the first End node added become the graph's entry and exit
     * points. Later ones are stored as well but reported through the returned outcome and
     * through {@link #validate()}.
     *
     * @param node node to add
     * @return what happened to the node
     */
    public AddOutcome addNode(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        if (nodes.containsKey(node.id())) {
            return AddOutcome.DUPLICATE_ID;
        }
        nodes.put(node.id(), node);

        if (node.kind() == NodeKind.START) {
            if (startNode != null) {
                extraStartNodes++;
                log.debug("Additional start node {} ignored as entry point", node.id());
                return AddOutcome.DUPLICATE_START;
            }
            startNode = node;
        } else if (node.kind() == NodeKind.END) {
            if (endNode != null) {
                extraEndNodes++;
                return AddOutcome.DUPLICATE_END;
            }
            endNode = node;
        }
        return AddOutcome.ADDED;
    }

    /**
     * Adds a flow connection.
     *
     * @param fromId source node identifier
     * @param toId target node identifier
     * @return true if a new edge was added
     * @see #connect(String, String, EdgeKind)
     */
    public boolean connect(String fromId, String toId) {
        return connect(fromId, toId, EdgeKind.FLOW);
    }

    /**
     * Adds a directed connection.
     *
     * <p>This is a no-op when either endpoint is absent, when both endpoints are the same
     * node, or when the edge already exists. A {@link EdgeKind#NEXT} edge sets the
     * successor of an IF/WHILE/FOR node; on any other node it is an ordinary flow edge.
     *
     * @param fromId source node identifier
     * @param toId target node identifier
     * @param kind edge kind
     * @return true if a new edge was added
     */
    public boolean connect(String fromId, String toId, EdgeKind kind) {
        Node from = fromId == null ? null : nodes.get(fromId);
        Node to = toId == null ? null : nodes.get(toId);
        if (from == null || to == null) {
            log.debug("Skipping connection {} -> {}: unknown endpoint", fromId, toId);
            return false;
        }
        if (from == to) {
            return false;
        }
        if (kind == EdgeKind.NEXT && from.kind().isBlock()) {
            return from.setNext(to);
        }
        return from.connectTo(to);
    }

    /**
     * Validates every node's required properties and the uniqueness of Start/End nodes.
     *
     * @return structural errors, empty when the graph is valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        for (Node node : nodes.values()) {
            errors.addAll(node.validate());
        }
        if (extraStartNodes > 0) {
            errors.add(DUPLICATE_START_ERROR);
        }
        if (extraEndNodes > 0) {
            errors.add(DUPLICATE_END_ERROR);
        }
        return errors;
    }

    /**
     * Returns advisory messages that never block compilation.
     *
     * @return warnings about a missing Start or End node
     */
    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        if (startNode == null) {
            warnings.add(MISSING_START_WARNING);
        }
        if (endNode == null) {
            warnings.add(MISSING_END_WARNING);
        }
        return warnings;
    }

    /**
     * Converts the graph into its tree form.
     *
     * @return serialized graph
     */
    public SerializedGraph serialize() {
        Map<String, SerializedNode> serialized = new LinkedHashMap<>();
        for (Node node : nodes.values()) {
            serialized.put(node.id(), serializeNode(node));
        }
        return new SerializedGraph(
            serialized,
            startNode == null ? null : startNode.id(),
            endNode == null ? null : endNode.id());
    }

    private SerializedNode serializeNode(Node node) {
        List<String> connections = node.connections().stream().map(Node::id).toList();
        boolean block = node.kind().isBlock();
        return new SerializedNode(
            node.id(),
            node.kind().id(),
            node.position(),
            node.properties().toMap(),
            connections,
            block ? connections : null,
            block ? node.next().map(Node::id).orElse(null) : null);
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Returns all nodes in insertion order.
     *
     * @return unmodifiable view of the nodes
     */
    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Optional<Node> startNode() {
        return Optional.ofNullable(startNode);
    }

    public Optional<Node> endNode() {
        return Optional.ofNullable(endNode);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
