package org.optiscope.driver;

import org.optiscope.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The result of one operation at a step boundary. The interactive controller decides its next
 * state from the status; batch mode turns anything but success into an exception.
 *
 * @param status      What happened.
 * @param summary     A one-line operator message.
 * @param diagnostics Diagnostics of a failed analysis; empty otherwise.
 * @param cause       The exception behind a failure or rejection, {@code null} otherwise.
 */
public record StepOutcome(Status status, String summary, List<Diagnostic> diagnostics, RuntimeException cause) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        REJECTED,
        QUIT
    }

    public StepOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    public static StepOutcome succeeded(String summary) {
        return new StepOutcome(Status.SUCCEEDED, summary, List.of(), null);
    }

    public static StepOutcome failed(String summary, List<Diagnostic> diagnostics, RuntimeException cause) {
        return new StepOutcome(Status.FAILED, summary, diagnostics, cause);
    }

    public static StepOutcome rejected(String summary, RuntimeException cause) {
        return new StepOutcome(Status.REJECTED, summary, List.of(), cause);
    }

    public static StepOutcome quit() {
        return new StepOutcome(Status.QUIT, "Quit", List.of(), null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    /**
     * Rethrows the cause of a failed or rejected outcome.
     * @return This outcome if it is not a failure or rejection.
     */
    public StepOutcome orThrow() {
        if (status == Status.FAILED || status == Status.REJECTED) {
            throw cause != null ? cause : new IllegalStateException(summary);
        }
        return this;
    }
}
