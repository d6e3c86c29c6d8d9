package com.visualcompiler.core.compiler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed connection between two blocks.
 *
 * @param from source block id
 * @param to target block id
 * @param kind {@code "next"} for the statement following an If/While/For block;
 *             null or {@code "flow"} otherwise
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectionSpec(
    @JsonProperty("from") String from,
    @JsonProperty("to") String to,
    @JsonProperty("kind") String kind
) {
    /**
     * Creates an unlabeled connection.
     *
     * @param from source block id
     * @param to target block id
     * @return connection spec
     */
    public static ConnectionSpec of(String from, String to) {
        return new ConnectionSpec(from, to, null);
    }
}
