package com.visualcompiler.core.renderer;

/**
 * Destination for compiled programs.
 *
 * <p>Renderers write generated source files, and optionally the serialized program graph,
 * to a target such as the filesystem or the console. They are discovered through the
 * Java Service Provider Interface.
 *
 * <p>A renderer that only logs what a compilation produced:
 * <pre>{@code
 * public class LoggingRenderer implements OutputRenderer {
 *     public String getId() { return "log"; }
 *
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         output.files().forEach(f -> log.info("{} ({} bytes)", f.relativePath(), f.content().length()));
 *     }
 * }
 * }</pre>
 *
 * <p>Implementations are listed in
 * {@code META-INF/services/com.visualcompiler.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lowercase identifier of this renderer.
     *
     * @return renderer identifier such as {@code "filesystem"} or {@code "console"}
     */
    String getId();

    /**
     * Renders the generated files to the target destination.
     *
     * @param output files produced by one compilation
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
