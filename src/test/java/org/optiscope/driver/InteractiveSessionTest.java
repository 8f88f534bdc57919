package org.optiscope.driver;

import org.optiscope.compiler.optimizer.StepDescriptor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.normalize;

@Tag("unit")
class InteractiveSessionTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private InteractiveSession session(Explorer explorer, String input) {
        return explorer.interactiveSession(new StringReader(input), new PrintWriter(out), new PrintWriter(err));
    }

    private static Explorer open(String source) {
        return Explorer.open(new SourceInput("test.yul", source), null, ExplorerSettings.defaults());
    }

    @Test
    void appliesChoicesUntilQuit() {
        Explorer explorer = open("{ sstore(0, add(1, 2)) }");
        InteractiveSession session = session(explorer, "s\n#");

        session.run();

        assertThat(session.getPhase()).isEqualTo(SessionPhase.TERMINATED);
        assertThat(explorer.render()).isEqualTo(normalize("{ sstore(0, 3) }"));
        assertThat(out.toString())
                .contains("#: >>> QUIT <<<")
                .contains("?  s")
                .contains("----------------------\n" + normalize("{ sstore(0, 3) }"));
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void endOfInputQuits() {
        InteractiveSession session = session(open("{ }"), "");

        session.run();

        assertThat(session.getPhase()).isEqualTo(SessionPhase.TERMINATED);
    }

    @Test
    void endOfTransmissionQuits() {
        Explorer explorer = open("{ sstore(0, add(1, 2)) }");
        InteractiveSession session = session(explorer, "\u0004s");

        session.run();

        assertThat(explorer.render()).isEqualTo(normalize("{ sstore(0, add(1, 2)) }"));
    }

    @Test
    void unknownChoiceIsReportedWithoutReprintingTheTree() {
        Explorer explorer = open("""
                object "A" {
                    code { sstore(0, add(1, 2)) }
                    object "B" { code { let x := 1 sstore(x, 0) } data "d" hex"00" }
                }""");
        String before = explorer.render();
        InteractiveSession session = session(explorer, "");

        StepOutcome outcome = session.handle('z');

        assertThat(outcome.status()).isEqualTo(StepOutcome.Status.REJECTED);
        assertThat(err.toString()).contains("Invalid choice: Unknown step code 'z'");
        assertThat(out.toString()).doesNotContain("----------------------");
        assertThat(session.getPhase()).isEqualTo(SessionPhase.AWAITING_INPUT);
        assertThat(explorer.render()).isEqualTo(before);
    }

    @Test
    void quitCodeTerminates() {
        InteractiveSession session = session(open("{ }"), "");

        assertThat(session.handle('#').status()).isEqualTo(StepOutcome.Status.QUIT);
        assertThat(session.getPhase()).isEqualTo(SessionPhase.TERMINATED);
    }

    @Test
    void utilitiesAreReachableThroughControlCodes() {
        Explorer explorer = open("{ let x_3 := calldataload(0) sstore(0, x_3) }");
        InteractiveSession session = session(explorer, ",#");

        session.run();

        assertThat(explorer.render()).isEqualTo(normalize("{ let x := calldataload(0) sstore(0, x) }"));
        assertThat(explorer.getState().isDisambiguated()).isFalse();
    }

    @Test
    void failingStepIsReportedAndSessionContinues() {
        Explorer explorer = open("{ }");
        explorer.getRegistry().register(new StepDescriptor('!', "Failing", false,
                (context, block) -> {
                    throw new IllegalStateException("boom");
                }));
        InteractiveSession session = session(explorer, "!s#");

        session.run();

        assertThat(err.toString())
                .contains("Exception during optimiser step:")
                .contains("boom");
        assertThat(out.toString()).contains("?  s");
        assertThat(session.getPhase()).isEqualTo(SessionPhase.TERMINATED);
    }

    @Test
    void controlCodesAreListedInMenuOrder() {
        assertThat(InteractiveSession.controlCodes()).containsKeys('#', ',', ';');
        assertThat(InteractiveSession.controlCodes().values())
                .containsExactly(">>> QUIT <<<", "VarNameCleaner", "StackCompressor");
    }
}
