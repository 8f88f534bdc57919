package org.optiscope.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.optiscope.cli.CommandLineInterface;
import org.optiscope.compiler.optimizer.StepRegistry;
import org.optiscope.driver.ConfigurationException;
import org.optiscope.driver.ExplorerSettings;
import org.optiscope.driver.InteractiveSession;
import org.optiscope.driver.UsageBanner;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the step menu shown by the interactive session.
 */
@Command(
    name = "steps",
    description = "List the available step codes"
)
public class StepsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ExplorerSettings settings = ExplorerSettings.fromConfig(parent.getConfig());
            out.print(UsageBanner.render(StepRegistry.initializeWithDefaults(),
                    InteractiveSession.controlCodes(), settings.menuColumns()));
            out.flush();
            return 0;
        } catch (ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return ExploreCommand.EXIT_ERROR;
        }
    }
}
