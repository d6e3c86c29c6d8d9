package com.visualcompiler.core.renderer.impl;

import com.visualcompiler.core.renderer.GeneratedFile;
import com.visualcompiler.core.renderer.GeneratedOutput;
import com.visualcompiler.core.renderer.OutputRenderer;
import com.visualcompiler.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Prints generated files to a console stream.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors for headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.headers} - print a header line per file ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - separator between files (default: "---")</li>
 * </ul>
 *
 * <p>File contents are printed unchanged so that generated code can be piped into a file.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.headers", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);

        List<GeneratedFile> files = output.files();
        log.debug("Printing {} files to console (colors: {}, headers: {})", files.size(), useColors, showHeaders);

        for (int i = 0; i < files.size(); i++) {
            GeneratedFile file = files.get(i);
            if (showHeaders) {
                printHeader(file, useColors);
            }
            out.println(file.content());
            if (i < files.size() - 1) {
                printSeparator(separator, useColors);
            }
        }
        out.flush();
    }

    private void printHeader(GeneratedFile file, boolean useColors) {
        String color = useColors ? ANSI_BOLD_CYAN : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(color + "File: " + file.relativePath() + " (" + file.content().length() + " bytes)" + reset);
    }

    private void printSeparator(String separator, boolean useColors) {
        if (separator.isEmpty()) {
            out.println();
            return;
        }
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(color + separator.repeat(Math.max(1, LINE_WIDTH / separator.length())) + reset);
    }
}
