package com.visualcompiler.cli;

import com.visualcompiler.core.compiler.CompilationResult;
import com.visualcompiler.core.compiler.CompilerService;
import com.visualcompiler.core.compiler.ProgramSpec;
import com.visualcompiler.core.compiler.StructureReport;
import com.visualcompiler.core.config.CompilerConfig;
import com.visualcompiler.core.config.ConfigLoader;
import com.visualcompiler.core.io.ProgramReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a program document without writing any output.
 *
 * <p>Reports structural problems of the raw block list first. When the structure is
 * sound, the program is compiled in memory to surface property and variable errors.
 * Exits with code 2 when the program has errors.
 */
@Command(
    name = "validate",
    description = "Check a visual program document for errors",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Program document (JSON)")
    private Path programFile;

    @Option(names = {"-l", "--language"}, description = "Target language to check against")
    private String language;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            log.info("Validating program: {}", programFile);
            CompilerConfig config = ConfigLoader.load(configPath);
            ProgramSpec program = new ProgramReader().read(programFile);
            CompilerService compiler = new CompilerService(config.toGeneratorConfig());

            StructureReport report = compiler.validateStructure(program.blocks(), program.connections());
            report.warnings().forEach(warning -> err.println("⚠ " + warning));
            if (!report.isValid()) {
                printErrors(err, "structure", report.errors());
                return CompileCommand.EXIT_INVALID_PROGRAM;
            }

            String languageId = language != null ? language
                : program.language() != null ? program.language() : config.language();
            CompilationResult result = compiler.compile(program.withLanguage(languageId));
            if (!result.success()) {
                printErrors(err, result.stage().name(), result.errors());
                return CompileCommand.EXIT_INVALID_PROGRAM;
            }

            out.println("✓ Program is valid (" + report.blockCount() + " blocks, "
                + report.connectionCount() + " connections, target: " + result.language() + ")");
            return 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            err.println("✗ Validation failed: " + e.getMessage());
            return CompileCommand.EXIT_FAILURE;
        }
    }

    private static void printErrors(PrintWriter err, String stage, List<String> errors) {
        err.println("✗ Program is invalid (" + stage + "):");
        errors.forEach(error -> err.println("  - " + error));
    }
}
