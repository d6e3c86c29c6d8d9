package com.visualcompiler.core.renderer.impl;

import com.visualcompiler.core.renderer.GeneratedFile;
import com.visualcompiler.core.renderer.GeneratedOutput;
import com.visualcompiler.core.renderer.OutputRenderer;
import com.visualcompiler.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated source files and the program graph below the output directory.
 *
 * <p>Missing directories are created and existing files are overwritten. Relative paths
 * that would escape the output directory are rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     GeneratedFile.source("program", ".py", code),
 *     GeneratedFile.graph(graphJson)
 * ));
 *
 * new FileSystemRenderer().render(output, new RenderContext("./build/generated", Map.of()));
 * // Creates ./build/generated/program.py and ./build/generated/graph.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Path.of(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Writing {} files to: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File path escapes output directory: " + file.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content());
            log.info("Wrote file: {} ({} bytes)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
