package com.visualcompiler.core.renderer;

import java.util.Objects;

/**
 * A file produced by one compilation.
 *
 * @param relativePath path relative to the output directory, e.g. {@code "program.py"}
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String GRAPH_FILE_NAME = "graph.json";

    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Creates the generated source file.
     *
     * @param baseName file name without extension
     * @param extension extension including the dot, e.g. {@code ".cpp"}
     * @param code generated source text
     * @return source file
     */
    public static GeneratedFile source(String baseName, String extension, String code) {
        return new GeneratedFile(baseName + extension, code, "text/plain");
    }

    /**
     * Creates the serialized program graph file.
     *
     * @param json graph as JSON
     * @return graph file
     */
    public static GeneratedFile graph(String json) {
        return new GeneratedFile(GRAPH_FILE_NAME, json, "application/json");
    }
}
