package com.visualcompiler.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.visualcompiler.cli.CommandTestSupport.COUNTDOWN_PROGRAM;
import static com.visualcompiler.cli.CommandTestSupport.write;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CompileCommand}.
 */
class CompileCommandTest {

    @TempDir
    Path tempDir;

    private CommandTestSupport cli;
    private Path program;
    private Path outputDir;
    private String noConfig;

    @BeforeEach
    void setUp() throws IOException {
        cli = new CommandTestSupport();
        program = write(tempDir, "countdown.json", COUNTDOWN_PROGRAM);
        outputDir = tempDir.resolve("out");
        noConfig = tempDir.resolve("absent.yaml").toString();
    }

    @Test
    void compile_usesLanguageOfDocument() throws IOException {
        int exitCode = cli.run("compile", program.toString(), "-o", outputDir.toString(), "-c", noConfig);

        assertThat(exitCode).isZero();
        String code = Files.readString(outputDir.resolve("program.c"));
        assertThat(code).contains(
            "    while (n > 0) {",
            "        printf(\"n =%d\\n\", n);",
            "        n = n - 1;",
            "    }",
            "    // Program End");
        assertThat(outputDir.resolve("graph.json")).exists();
        assertThat(cli.out()).contains("✓ Generated program.c");
    }

    @Test
    void compile_languageOption_overridesDocument() throws IOException {
        int exitCode = cli.run("compile", program.toString(), "-l", "python", "-o", outputDir.toString(), "-c", noConfig);

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("program.py"))).contains("while n > 0:", "    print(\"n =\", n)");
    }

    @Test
    void compile_java_namesFileAfterClass() throws IOException {
        Path config = write(tempDir, "visual-compiler.yaml", """
            generator:
              className: Countdown
            """);

        int exitCode = cli.run("compile", program.toString(), "-l", "java", "-o", outputDir.toString(),
            "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("Countdown.java"))).startsWith("import java.util.Scanner;")
            .contains("public class Countdown {");
    }

    @Test
    void compile_configOutputSettings_areApplied() throws IOException {
        Path config = write(tempDir, "visual-compiler.yaml", """
            output:
              directory: "%s"
              emitGraph: false
              fileName: countdown
            """.formatted(outputDir.toString().replace("\\", "/")));

        int exitCode = cli.run("compile", program.toString(), "-l", "cpp", "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("countdown.cpp")).exists();
        assertThat(outputDir.resolve("graph.json")).doesNotExist();
    }

    @Test
    void compile_noGraph_writesSourceOnly() {
        int exitCode = cli.run("compile", program.toString(), "--no-graph", "-o", outputDir.toString(), "-c", noConfig);

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("program.c")).exists();
        assertThat(outputDir.resolve("graph.json")).doesNotExist();
    }

    @Test
    void compile_console_printsInsteadOfWriting() {
        PrintStream stdout = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        int exitCode;
        try {
            exitCode = cli.run("compile", program.toString(), "--console", "--no-graph",
                "-o", outputDir.toString(), "-c", noConfig);
        } finally {
            System.setOut(stdout);
        }

        assertThat(exitCode).isZero();
        assertThat(captured.toString(StandardCharsets.UTF_8)).contains("File: program.c", "int main() {");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void compile_invalidProgram_exitsWithTwoAndListsErrors() throws IOException {
        Path invalid = write(tempDir, "invalid.json", """
            {
              "language": "python",
              "blocks": [
                { "id": "s", "type": "start" },
                { "id": "p", "type": "print" }
              ],
              "connections": [ { "from": "s", "to": "p" } ]
            }
            """);

        int exitCode = cli.run("compile", invalid.toString(), "-o", outputDir.toString(), "-c", noConfig);

        assertThat(exitCode).isEqualTo(2);
        assertThat(cli.err()).contains(
            "✗ Compilation failed at stage VALIDATION",
            "Print statement must have text or variables",
            "⚠ Consider adding an end node to define the program exit point");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void compile_unsupportedLanguage_exitsWithTwo() {
        int exitCode = cli.run("compile", program.toString(), "-l", "cobol", "-o", outputDir.toString(), "-c", noConfig);

        assertThat(exitCode).isEqualTo(2);
        assertThat(cli.err()).contains("Unsupported language: cobol");
    }

    @Test
    void compile_missingProgramFile_exitsWithOne() {
        int exitCode = cli.run("compile", tempDir.resolve("nope.json").toString(), "-c", noConfig);

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("✗ Compilation failed: Program file not found");
    }

    @Test
    void compile_malformedProgram_exitsWithOne() throws IOException {
        Path broken = write(tempDir, "broken.json", "{ \"blocks\": ");

        int exitCode = cli.run("compile", broken.toString(), "-c", noConfig);

        assertThat(exitCode).isEqualTo(1);
    }
}
