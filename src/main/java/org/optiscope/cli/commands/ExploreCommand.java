package org.optiscope.cli.commands;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.optiscope.cli.CommandLineInterface;
import org.optiscope.compiler.diagnostics.AnalysisException;
import org.optiscope.compiler.diagnostics.Diagnostic;
import org.optiscope.compiler.diagnostics.DiagnosticFormatter;
import org.optiscope.compiler.diagnostics.ParseException;
import org.optiscope.driver.ConfigurationException;
import org.optiscope.driver.Explorer;
import org.optiscope.driver.ExplorerSettings;
import org.optiscope.driver.InvariantViolationException;
import org.optiscope.driver.ObjectLoader;
import org.optiscope.driver.SourceInput;
import org.optiscope.driver.UnknownStepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Parses an object (or bare code block), validates it and applies optimizer steps to it, either
 * as one fixed sequence or interactively one character at a time.
 * <p>
 * Exit codes: 0 on success, 1 for usage, input, parse and analysis errors, 3 when an internal
 * invariant is violated.
 */
@Command(
    name = "explore",
    description = "Apply optimizer steps to an object and print the result after each step"
)
public class ExploreCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExploreCommand.class);

    static final int EXIT_ERROR = 1;
    static final int EXIT_INVARIANT_VIOLATION = 3;
    private static final String STDIN = "-";

    @Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "<file>",
        description = "Source file, or - to read from standard input (implies --non-interactive)"
    )
    private String file;

    @Option(
        names = {"-s", "--steps"},
        description = "Step codes to apply before the interactive session, e.g. \"fxs[u]\""
    )
    private String steps;

    @Option(
        names = {"-o", "--object"},
        description = "Dotted path of the (sub-)object to work on, starting with the root name"
    )
    private String objectPath;

    @Option(
        names = {"-n", "--non-interactive"},
        description = "Apply --steps, print the result and exit"
    )
    private boolean nonInteractive;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private Reader operatorInput;
    private InputStream sourceInput = System.in;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (file == null) {
            err.println("Error: No input file given. Use - to read from standard input.");
            return EXIT_ERROR;
        }
        boolean interactive = !nonInteractive && !STDIN.equals(file);
        boolean hasSteps = steps != null && !steps.isBlank();
        if (!interactive && !hasSteps) {
            err.println("Error: --steps is required in non-interactive mode.");
            return EXIT_ERROR;
        }

        SourceInput source = null;
        try {
            ExplorerSettings settings = ExplorerSettings.fromConfig(parent.getConfig());
            ObjectLoader loader = new ObjectLoader();
            source = STDIN.equals(file) ? loader.read(sourceInput) : loader.read(Path.of(file));
            Explorer explorer = Explorer.open(source, objectPath, settings);

            if (interactive) {
                out.println(explorer.render());
            }
            if (hasSteps) {
                if (interactive) {
                    out.println(settings.separator());
                }
                explorer.batchRunner().run(steps);
                out.println(explorer.render());
            }
            out.flush();
            if (interactive) {
                explorer.interactiveSession(operatorInput(), out, err).run();
            }
            return 0;
        } catch (ConfigurationException | UnknownStepException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            printDiagnostics(source, e.getDiagnostics(), err);
            return EXIT_ERROR;
        } catch (AnalysisException e) {
            err.println("Error: " + e.getMessage());
            printDiagnostics(source, e.getDiagnostics(), err);
            return EXIT_ERROR;
        } catch (InvariantViolationException e) {
            log.error("Internal invariant violated", e);
            err.println("Internal error: " + e.getMessage());
            return EXIT_INVARIANT_VIOLATION;
        } catch (RuntimeException e) {
            // a step threw during the batch sequence
            log.debug("Batch step failed", e);
            err.println("Exception during optimiser step:");
            err.println(e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_ERROR;
        } finally {
            err.flush();
        }
    }

    void setOperatorInput(Reader operatorInput) {
        this.operatorInput = operatorInput;
    }

    void setSourceInput(InputStream sourceInput) {
        this.sourceInput = sourceInput;
    }

    private Reader operatorInput() {
        return operatorInput != null ? operatorInput : new InputStreamReader(System.in, StandardCharsets.UTF_8);
    }

    private static void printDiagnostics(SourceInput source, List<Diagnostic> diagnostics, PrintWriter err) {
        new DiagnosticFormatter(source == null ? null : source.text()).print(diagnostics, err);
    }
}
