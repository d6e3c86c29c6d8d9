package com.visualcompiler.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by one compilation, in rendering order.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Returns the total size of all file contents.
     *
     * @return number of characters
     */
    public int totalSize() {
        return files.stream().mapToInt(file -> file.content().length()).sum();
    }
}
