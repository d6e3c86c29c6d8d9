package com.visualcompiler.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.visualcompiler.cli.CommandTestSupport.COUNTDOWN_PROGRAM;
import static com.visualcompiler.cli.CommandTestSupport.write;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private CommandTestSupport cli;
    private String noConfig;

    @BeforeEach
    void setUp() {
        cli = new CommandTestSupport();
        noConfig = tempDir.resolve("absent.yaml").toString();
    }

    @Test
    void validate_validProgram_exitsWithZero() throws IOException {
        Path program = write(tempDir, "countdown.json", COUNTDOWN_PROGRAM);

        int exitCode = cli.run("validate", program.toString(), "-c", noConfig);

        assertThat(exitCode).isZero();
        assertThat(cli.out()).contains("✓ Program is valid (6 blocks, 6 connections, target: c)");
    }

    @Test
    void validate_structuralErrors_exitWithTwo() throws IOException {
        Path program = write(tempDir, "twostarts.json", """
            {
              "blocks": [
                { "id": "a", "type": "start" },
                { "id": "b", "type": "start" },
                { "type": "print", "properties": { "text": "hi" } }
              ]
            }
            """);

        int exitCode = cli.run("validate", program.toString(), "-c", noConfig);

        assertThat(exitCode).isEqualTo(2);
        assertThat(cli.err()).contains(
            "✗ Program is invalid (structure):",
            "  - Program can only have one Start block",
            "  - Found block without ID",
            "⚠ Consider adding an End block to clearly mark the end");
    }

    @Test
    void validate_undeclaredVariable_exitsWithTwo() throws IOException {
        Path program = write(tempDir, "undeclared.json", """
            {
              "language": "java",
              "blocks": [
                { "id": "s", "type": "start" },
                { "id": "p", "type": "print", "properties": { "variables": ["total"] } },
                { "id": "e", "type": "end" }
              ],
              "connections": [ { "from": "s", "to": "p" }, { "from": "p", "to": "e" } ]
            }
            """);

        int exitCode = cli.run("validate", program.toString(), "-c", noConfig);

        assertThat(exitCode).isEqualTo(2);
        assertThat(cli.err()).contains("SEMANTIC_ANALYSIS", "Variable 'total' used in print but not declared");
    }

    @Test
    void validate_languageOption_isChecked() throws IOException {
        Path program = write(tempDir, "countdown.json", COUNTDOWN_PROGRAM);

        int exitCode = cli.run("validate", program.toString(), "-l", "fortran", "-c", noConfig);

        assertThat(exitCode).isEqualTo(2);
        assertThat(cli.err()).contains("Unsupported language: fortran");
    }

    @Test
    void validate_missingFile_exitsWithOne() {
        int exitCode = cli.run("validate", tempDir.resolve("nope.json").toString(), "-c", noConfig);

        assertThat(exitCode).isEqualTo(1);
    }
}
