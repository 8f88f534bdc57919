package org.optiscope.cli.commands;

import org.optiscope.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the explore command: exit codes, batch output and a scripted interactive session.
 */
@Tag("integration")
public class ExploreCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmdLine;
    private ExploreCommand command;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        command = cmdLine.getSubcommands().get("explore").getCommand();
    }

    private Path source(String text) throws IOException {
        return Files.writeString(tempDir.resolve("input.yul"), text);
    }

    private int execute(String... args) {
        return cmdLine.execute(args);
    }

    @Test
    void testCommandIsRegistered() {
        assertThat(cmdLine.getSubcommands()).containsKeys("explore", "steps");
    }

    @Test
    void testNonInteractivePrintsOnlyTheResult() throws Exception {
        Path file = source("{ sstore(0, add(1, 2)) }");

        int exitCode = execute("explore", "-n", "-s", "s", file.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(out.toString()).isEqualTo("{ sstore(0, 3) }" + System.lineSeparator());
    }

    @Test
    void testStandardInputImpliesNonInteractive() {
        command.setSourceInput(new ByteArrayInputStream("{ sstore(0, add(2, 2)) }".getBytes(StandardCharsets.UTF_8)));

        int exitCode = execute("explore", "-s", "s", "-");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("{ sstore(0, 4) }");
    }

    @Test
    void testStepsAreRequiredWithoutInteraction() throws Exception {
        Path file = source("{ }");

        int exitCode = execute("explore", "-n", file.toString());

        assertThat(exitCode).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("--steps is required");
    }

    @Test
    void testMissingInputIsAnError() {
        assertThat(execute("explore")).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("No input file given");
    }

    @Test
    void testMissingFileIsAnError() {
        int exitCode = execute("explore", "-n", "-s", "s", tempDir.resolve("missing.yul").toString());

        assertThat(exitCode).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Error: File not found");
    }

    @Test
    void testUnknownStepCodeIsAnError() throws Exception {
        Path file = source("{ }");

        int exitCode = execute("explore", "-n", "-s", "sq", file.toString());

        assertThat(exitCode).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Error: Unknown step code 'q'");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testParseErrorIsReportedWithDiagnostics() throws Exception {
        Path file = source("{ let x := }");

        int exitCode = execute("explore", "-n", "-s", "s", file.toString());

        assertThat(exitCode).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).startsWith("Error: ");
    }

    @Test
    void testInvalidCodeIsReportedWithDiagnostics() throws Exception {
        Path file = source("{ sstore(0, y) }");

        int exitCode = execute("explore", "-n", "-s", "s", file.toString());

        assertThat(exitCode).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Invalid code in object 'object'").contains("Identifier \"y\" not found.");
    }

    @Test
    void testObjectPathSelectsSubObject() throws Exception {
        Path file = source("""
            object "A" {
                code { }
                object "B" { code { sstore(0, add(1, 1)) } }
            }""");

        int exitCode = execute("explore", "-n", "-s", "s", "-o", "A.B", file.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).startsWith("object \"B\"").contains("sstore(0, 2)");
    }

    @Test
    void testUnknownObjectPathIsAnError() throws Exception {
        Path file = source("object \"A\" { code { } }");

        assertThat(execute("explore", "-n", "-s", "s", "-o", "A.X", file.toString()))
            .isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("'X' not found");
    }

    @Test
    void testInteractiveSessionAppliesChoices() throws Exception {
        Path file = source("{ sstore(0, add(1, 2)) }");
        command.setOperatorInput(new StringReader("s\n#\n"));

        int exitCode = execute("explore", file.toString());

        assertThat(exitCode).isEqualTo(0);
        String output = out.toString();
        assertThat(output).startsWith("{ sstore(0, add(1, 2)) }");
        assertThat(output).contains("s: ExpressionSimplifier").contains("#: >>> QUIT <<<");
        assertThat(output).contains("{ sstore(0, 3) }");
    }

    @Test
    void testInteractiveSessionReportsInvalidChoice() throws Exception {
        Path file = source("{ }");
        command.setOperatorInput(new StringReader("z#"));

        int exitCode = execute("explore", file.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(err.toString()).contains("Invalid choice");
    }

    @Test
    void testInvalidConfigurationIsAnError() throws Exception {
        Path config = Files.writeString(tempDir.resolve("bad.conf"), "optiscope.menu-columns = 0");
        Path file = source("{ }");

        int exitCode = execute("-c", config.toString(), "explore", "-n", "-s", "s", file.toString());

        assertThat(exitCode).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Error: ").contains("menu-columns");
    }
}
