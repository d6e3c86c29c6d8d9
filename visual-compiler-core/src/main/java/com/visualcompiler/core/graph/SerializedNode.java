package com.visualcompiler.core.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.visualcompiler.core.model.Position;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree form of a single node.
 *
 * @param id node identifier
 * @param type node kind id
 * @param position canvas position
 * @param properties property bag using wire key names
 * @param connections identifiers of flow-connected nodes
 * @param body identifiers of body nodes, only for IF/WHILE/FOR
 * @param next identifier of the block successor, only for IF/WHILE/FOR when connected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SerializedNode(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("position") Position position,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("connections") List<String> connections,
    @JsonProperty("body") List<String> body,
    @JsonProperty("next") String next
) {
    public SerializedNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (properties == null) {
            properties = Map.of();
        }
        if (connections == null) {
            connections = List.of();
        }
    }
}
