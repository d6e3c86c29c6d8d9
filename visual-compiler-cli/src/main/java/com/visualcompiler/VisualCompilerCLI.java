package com.visualcompiler;

import ch.qos.logback.classic.Level;
import com.visualcompiler.cli.CompileCommand;
import com.visualcompiler.cli.ListCommand;
import com.visualcompiler.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point of the visual compiler.
 *
 * <p>Compiles visual block programs (JSON documents exported by a block editor) into
 * C, C++, Python or Java source code.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Compile a program document to source code</li>
 *   <li>{@code validate} - Check a program document without writing output</li>
 *   <li>{@code list} - List languages, editor blocks or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Compile to Python into ./build/generated
 * visual-compiler compile program.json
 *
 * # Print Java code to the console
 * visual-compiler compile program.json -l java --console
 *
 * # List supported languages
 * visual-compiler list languages
 * }</pre>
 */
@Command(
    name = "visual-compiler",
    mixinStandardHelpOptions = true,
    version = "Visual Compiler 1.0.0-SNAPSHOT",
    description = "Compiles visual block programs into C, C++, Python or Java source code",
    subcommands = {
        CompileCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class VisualCompilerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(VisualCompilerCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        System.out.println("Visual Compiler - block programs to C, C++, Python and Java");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'visual-compiler --help' to see available commands");
        System.out.println("Use 'visual-compiler <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options before the selected subcommand runs.
     *
     * @param parseResult parsed command line
     * @return exit code of the executed command
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Creates the command line with the global options wired in.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        VisualCompilerCLI cli = new VisualCompilerCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
