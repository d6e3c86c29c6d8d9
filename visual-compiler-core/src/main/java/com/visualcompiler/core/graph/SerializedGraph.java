package com.visualcompiler.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Tree form of a whole program graph, handed to downstream consumers and written
 * as {@code graph.json} by the renderers.
 *
 * @param nodes nodes keyed by identifier, in insertion order
 * @param startNodeId identifier of the entry node, null when absent
 * @param endNodeId identifier of the exit node, null when absent
 */
public record SerializedGraph(
    @JsonProperty("nodes") Map<String, SerializedNode> nodes,
    @JsonProperty("start_node_id") String startNodeId,
    @JsonProperty("end_node_id") String endNodeId
) {
    public SerializedGraph {
        Objects.requireNonNull(nodes, "nodes must not be null");
    }
}
