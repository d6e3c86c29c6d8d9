package com.visualcompiler.core.compiler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.visualcompiler.core.graph.SerializedGraph;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of compiling a visual program.
 *
 * @param success whether source text was generated
 * @param stage stage the pipeline ended in
 * @param errors error messages of the failing stage, empty on success
 * @param warnings advisory messages
 * @param code generated source text, null on failure
 * @param language target language id
 * @param graph serialized program graph, null when compilation stopped before generation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompilationResult(
    boolean success,
    CompilationStage stage,
    List<String> errors,
    List<String> warnings,
    String code,
    String language,
    SerializedGraph graph
) {
    public CompilationResult {
        Objects.requireNonNull(stage, "stage must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static CompilationResult failure(CompilationStage stage, List<String> errors, List<String> warnings, String language) {
        return new CompilationResult(false, stage, errors, warnings, null, language, null);
    }

    static CompilationResult success(String code, String language, List<String> warnings, SerializedGraph graph) {
        return new CompilationResult(true, CompilationStage.CODE_GENERATION, List.of(), warnings, code, language, graph);
    }
}
