package com.visualcompiler.cli;

import com.visualcompiler.core.language.BlockCatalog;
import com.visualcompiler.core.language.BlockDescriptor;
import com.visualcompiler.core.language.BlockInput;
import com.visualcompiler.core.language.LanguageConfigs;
import com.visualcompiler.core.language.LanguageSummary;
import com.visualcompiler.core.language.TargetLanguage;
import com.visualcompiler.core.renderer.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list supported languages, the editor blocks of a language, or the output
 * renderers discovered via SPI.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * visual-compiler list languages
 * visual-compiler list blocks python
 * visual-compiler list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available languages, blocks or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: languages, blocks or renderers")
    private String type;

    @Parameters(index = "1", arity = "0..1", description = "Language id for 'blocks' (default: python)")
    private String languageId;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "languages", "language" -> listLanguages(out);
            case "blocks", "block" -> listBlocks(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: languages, blocks or renderers", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type);
                yield CompileCommand.EXIT_FAILURE;
            }
        };
    }

    private int listLanguages(PrintWriter out) {
        out.println("Available Languages:");
        out.println();
        for (LanguageSummary language : LanguageConfigs.availableLanguages()) {
            out.printf("  • %s (ID: %s)%n", language.name(), language.id());
        }
        return 0;
    }

    private int listBlocks(PrintWriter out) {
        String id = languageId == null ? TargetLanguage.PYTHON.id() : languageId;
        Optional<TargetLanguage> language = TargetLanguage.fromId(id);
        if (language.isEmpty()) {
            spec.commandLine().getErr().println("✗ Unsupported language: " + id);
            return CompileCommand.EXIT_FAILURE;
        }

        out.println("Available Blocks (" + LanguageConfigs.get(language.get()).name() + "):");
        out.println();
        for (BlockDescriptor block : BlockCatalog.blocksFor(language.get())) {
            out.printf("  • %s (ID: %s, category: %s)%n", block.name(), block.id(), block.category());
            out.printf("    %s%n", block.description());
            for (BlockInput input : block.inputs()) {
                if (input.options().isEmpty()) {
                    out.printf("    - %s%n", input.name());
                } else {
                    out.printf("    - %s: %s%n", input.name(), String.join(" | ", input.options()));
                }
            }
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
