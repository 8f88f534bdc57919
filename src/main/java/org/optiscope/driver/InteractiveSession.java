package org.optiscope.driver;

import org.optiscope.compiler.diagnostics.DiagnosticFormatter;
import org.optiscope.compiler.optimizer.StepRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The interactive loop: show the menu, read one character, apply it to the tree, report and
 * print the result, repeat until quit or end of input.
 * <p>
 * Failures of a single step are reported on the error channel and leave the session usable with
 * the tree as the failing step left it. Only an {@link InvariantViolationException} ends the
 * session early.
 */
public class InteractiveSession {

    private static final Logger log = LoggerFactory.getLogger(InteractiveSession.class);

    public static final char QUIT = '#';
    public static final char VAR_NAME_CLEANER = ',';
    public static final char STACK_COMPRESSOR = ';';
    private static final char END_OF_TRANSMISSION = 4;
    private static final String PROMPT = "? ";

    private final SessionState state;
    private final TransformationSequencer sequencer;
    private final StepRegistry registry;
    private final ExplorerSettings settings;
    private final TreeRenderer renderer;
    private final DiagnosticFormatter formatter;
    private final Reader in;
    private final PrintWriter out;
    private final PrintWriter err;
    private SessionPhase phase = SessionPhase.INITIAL;

    public InteractiveSession(SessionState state, TransformationSequencer sequencer, StepRegistry registry,
                              ExplorerSettings settings, TreeRenderer renderer, SourceInput source,
                              Reader in, PrintWriter out, PrintWriter err) {
        this.state = state;
        this.sequencer = sequencer;
        this.registry = registry;
        this.settings = settings;
        this.renderer = renderer;
        this.formatter = new DiagnosticFormatter(source.text());
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /**
     * @return The menu control codes in display order.
     */
    public static Map<Character, String> controlCodes() {
        Map<Character, String> codes = new LinkedHashMap<>();
        // sorts before all step names
        codes.put(QUIT, ">>> QUIT <<<");
        codes.put(VAR_NAME_CLEANER, UtilityKind.VAR_NAME_CLEANER.getDisplayName());
        codes.put(STACK_COMPRESSOR, UtilityKind.STACK_COMPRESSOR.getDisplayName());
        return codes;
    }

    /**
     * Runs the loop until quit or end of input.
     */
    public void run() {
        if (!state.isDisambiguated()) {
            report(sequencer.disambiguate());
        }
        String banner = UsageBanner.render(registry, controlCodes(), settings.menuColumns());
        phase = SessionPhase.AWAITING_INPUT;
        log.debug("Interactive session started");
        while (phase != SessionPhase.TERMINATED) {
            out.print(banner);
            out.print(PROMPT);
            out.flush();
            int choice = readChoice();
            out.println(choice < 0 ? "" : " " + (char) choice);
            handle(choice);
        }
        out.flush();
        log.debug("Interactive session terminated");
    }

    /**
     * Dispatches one operator choice.
     * @param choice The character read, or -1 for end of input.
     * @return The outcome; the session phase is {@link SessionPhase#TERMINATED} after a quit.
     */
    public StepOutcome handle(int choice) {
        if (choice < 0 || choice == END_OF_TRANSMISSION || choice == QUIT) {
            phase = SessionPhase.TERMINATED;
            return StepOutcome.quit();
        }
        char code = (char) choice;
        phase = SessionPhase.APPLYING;
        log.debug("Applying '{}'", code);
        StepOutcome outcome;
        try {
            if (code == VAR_NAME_CLEANER) {
                outcome = sequencer.runNamedUtility(UtilityKind.VAR_NAME_CLEANER);
            } else if (code == STACK_COMPRESSOR) {
                outcome = sequencer.runNamedUtility(UtilityKind.STACK_COMPRESSOR);
            } else if (!registry.contains(code)) {
                UnknownStepException unknown = new UnknownStepException(code);
                outcome = StepOutcome.rejected("Invalid choice: " + unknown.getMessage(), unknown);
            } else {
                outcome = sequencer.runSequence(String.valueOf(code));
            }
        } catch (InvariantViolationException e) {
            phase = SessionPhase.TERMINATED;
            throw e;
        } catch (RuntimeException e) {
            log.debug("Step '{}' threw", code, e);
            outcome = StepOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), List.of(), e);
        }
        phase = SessionPhase.VALIDATING;
        state.resetStepContext();
        report(outcome);
        phase = SessionPhase.AWAITING_INPUT;
        return outcome;
    }

    public SessionPhase getPhase() {
        return phase;
    }

    private void report(StepOutcome outcome) {
        switch (outcome.status()) {
            case SUCCEEDED -> {
                log.debug(outcome.summary());
                printTree();
            }
            case FAILED -> {
                err.println();
                err.println("Exception during optimiser step:");
                err.println(outcome.summary());
                formatter.print(outcome.diagnostics(), err);
                err.flush();
                printTree();
            }
            case REJECTED -> {
                err.println(outcome.summary());
                err.flush();
            }
            case QUIT -> { }
        }
    }

    private void printTree() {
        out.println(settings.separator());
        out.println(renderer.render(state));
        out.flush();
    }

    /**
     * Reads the next non-whitespace character.
     * @return The character, or -1 at end of input.
     */
    private int readChoice() {
        try {
            int c;
            do {
                c = in.read();
            } while (c == ' ' || c == '\t' || c == '\r' || c == '\n');
            return c;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read the operator input", e);
        }
    }
}
