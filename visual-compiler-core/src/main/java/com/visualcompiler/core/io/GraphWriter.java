package com.visualcompiler.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.visualcompiler.core.compiler.CompilationResult;
import com.visualcompiler.core.graph.SerializedGraph;

import java.util.Objects;

/**
 * Writes serialized graphs and compilation results as pretty-printed JSON.
 */
public class GraphWriter {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Converts a serialized graph to JSON.
     *
     * @param graph serialized graph
     * @return JSON text
     * @throws IllegalStateException if the graph cannot be serialized
     */
    public String write(SerializedGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        return toJson(graph);
    }

    /**
     * Converts a compilation result to JSON.
     *
     * @param result compilation result
     * @return JSON text
     * @throws IllegalStateException if the result cannot be serialized
     */
    public String write(CompilationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return toJson(result);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
