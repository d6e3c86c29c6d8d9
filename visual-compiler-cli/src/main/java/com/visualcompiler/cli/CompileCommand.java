package com.visualcompiler.cli;

import com.visualcompiler.core.compiler.CompilationResult;
import com.visualcompiler.core.compiler.CompilerService;
import com.visualcompiler.core.compiler.ProgramSpec;
import com.visualcompiler.core.config.CompilerConfig;
import com.visualcompiler.core.config.ConfigLoader;
import com.visualcompiler.core.io.GraphWriter;
import com.visualcompiler.core.io.ProgramReader;
import com.visualcompiler.core.language.LanguageConfig;
import com.visualcompiler.core.language.LanguageConfigs;
import com.visualcompiler.core.language.TargetLanguage;
import com.visualcompiler.core.renderer.GeneratedFile;
import com.visualcompiler.core.renderer.GeneratedOutput;
import com.visualcompiler.core.renderer.OutputRenderer;
import com.visualcompiler.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to compile a program document to source code.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Read the program document</li>
 *   <li>Validate, analyze and generate code</li>
 *   <li>Render the source file, and the program graph, with the selected renderer</li>
 * </ol>
 *
 * <p>The target language is taken from {@code --language}, then from the program
 * document, then from the configuration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Compile to the language named in the document
 * visual-compiler compile program.json
 *
 * # Compile to C++ into a custom directory, without graph.json
 * visual-compiler compile program.json -l cpp -o out --no-graph
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Compile a visual program document to source code",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_PROGRAM = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Program document (JSON)")
    private Path programFile;

    @Option(names = {"-l", "--language"}, description = "Target language: c, cpp, python or java")
    private String language;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--console"}, description = "Print the generated files instead of writing them")
    private boolean console;

    @Option(names = {"--no-graph"}, description = "Do not emit graph.json")
    private boolean noGraph;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            CompilerConfig config = ConfigLoader.load(configPath);
            ProgramSpec program = new ProgramReader().read(programFile);
            String languageId = resolveLanguage(program, config);
            log.info("Compiling {} to {}", programFile, languageId);

            CompilationResult result = new CompilerService(config.toGeneratorConfig())
                .compile(program.withLanguage(languageId));
            result.warnings().forEach(warning -> err.println("⚠ " + warning));

            if (!result.success()) {
                err.println("✗ Compilation failed at stage " + result.stage() + ":");
                result.errors().forEach(error -> err.println("  - " + error));
                return EXIT_INVALID_PROGRAM;
            }

            GeneratedOutput output = toOutput(result, config);
            OutputRenderer renderer = findRenderer(console ? "console" : "filesystem");
            String directory = outputDir != null
                ? outputDir.toAbsolutePath().toString()
                : config.output().directory();
            renderer.render(output, new RenderContext(directory, Map.of()));

            if (!console) {
                out.println("✓ Generated " + output.files().get(0).relativePath() + " in " + directory);
            }
            return 0;
        } catch (Exception e) {
            log.error("Compilation failed", e);
            err.println("✗ Compilation failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private String resolveLanguage(ProgramSpec program, CompilerConfig config) {
        if (language != null && !language.isBlank()) {
            return language;
        }
        if (program.language() != null && !program.language().isBlank()) {
            return program.language();
        }
        return config.language();
    }

    private GeneratedOutput toOutput(CompilationResult result, CompilerConfig config) {
        TargetLanguage target = TargetLanguage.fromId(result.language()).orElseThrow();
        LanguageConfig languageConfig = LanguageConfigs.get(target);
        // A public Java class must live in a file named after it.
        String baseName = target == TargetLanguage.JAVA
            ? config.toGeneratorConfig().className()
            : config.output().fileName();

        List<GeneratedFile> files = new ArrayList<>();
        files.add(GeneratedFile.source(baseName, languageConfig.extension(), result.code()));
        if (config.output().emitGraph() && !noGraph && result.graph() != null) {
            files.add(GeneratedFile.graph(new GraphWriter().write(result.graph())));
        }
        return new GeneratedOutput(files);
    }

    private OutputRenderer findRenderer(String id) {
        log.debug("Discovering output renderers via ServiceLoader");
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (id.equals(renderer.getId())) {
                return renderer;
            }
        }
        throw new IllegalStateException("Renderer not found: " + id);
    }
}
