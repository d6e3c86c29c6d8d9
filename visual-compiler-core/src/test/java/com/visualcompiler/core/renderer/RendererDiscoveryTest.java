package com.visualcompiler.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that the bundled renderers are registered for SPI discovery.
 */
class RendererDiscoveryTest {

    @Test
    void serviceLoader_findsBundledRenderers() {
        List<String> ids = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderer -> ids.add(renderer.getId()));

        assertThat(ids).containsExactlyInAnyOrder("filesystem", "console");
    }

    @Test
    void generatedFile_factoriesNameFiles() {
        assertThat(GeneratedFile.source("VisualProgram", ".java", "class X {}").relativePath())
            .isEqualTo("VisualProgram.java");
        assertThat(GeneratedFile.graph("{}").relativePath()).isEqualTo("graph.json");
        assertThat(GeneratedFile.graph("{}").contentType()).isEqualTo("application/json");
    }

    @Test
    void generatedOutput_totalSize_sumsContents() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.source("a", ".c", "abc"),
            GeneratedFile.graph("{}")));

        assertThat(output.totalSize()).isEqualTo(5);
    }

    @Test
    void renderContext_missingSetting_usesDefault() {
        RenderContext context = new RenderContext("out", null);

        assertThat(context.getSettingOrDefault("console.colors", "false")).isEqualTo("false");
    }
}
