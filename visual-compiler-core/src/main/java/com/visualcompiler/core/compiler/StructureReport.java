package com.visualcompiler.core.compiler;

import java.util.List;

/**
 * Result of the structural pre-check of a raw block list.
 *
 * @param errors structural errors
 * @param warnings advisory messages
 * @param blockCount number of blocks checked
 * @param connectionCount number of connections checked
 */
public record StructureReport(
    List<String> errors,
    List<String> warnings,
    int blockCount,
    int connectionCount
) {
    public StructureReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
