package org.optiscope.cli.commands;

import org.optiscope.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class StepsCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testListsStepsAndControlCodes() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("steps");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
            .contains("f: BlockFlattener")
            .contains("T: LiteralRematerialiser")
            .contains(",: VarNameCleaner")
            .contains("#: >>> QUIT <<<");
    }

    @Test
    void testColumnCountComesFromConfiguration() throws Exception {
        Path config = Files.writeString(tempDir.resolve("one-column.conf"), "optiscope.menu-columns = 1");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("-c", config.toString(), "steps");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().lines()).hasSize(16);
    }

    @Test
    void testMissingConfigurationFileIsAnError() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("-c", tempDir.resolve("missing.conf").toString(), "steps");

        assertThat(exitCode).isEqualTo(ExploreCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
