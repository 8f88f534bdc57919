package org.optiscope.compiler.optimizer.features.controlflow;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.apply;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.normalize;

@Tag("unit")
class ControlFlowSimplifierTest {

    private final ControlFlowSimplifier simplifier = new ControlFlowSimplifier();

    @Test
    void resolvesConstantIfConditions() {
        assertThat(apply(simplifier, "{ if 0 { sstore(0, 1) } if 1 { sstore(0, 2) } }"))
                .isEqualTo(normalize("{ { sstore(0, 2) } }"));
    }

    @Test
    void emptyIfKeepsOnlyConditionSideEffects() {
        assertThat(apply(simplifier, "{ if sload(0) { } function f() -> r { } if f() { } }"))
                .isEqualTo(normalize("{ function f() -> r { } pop(f()) }"));
    }

    @Test
    void selectsMatchingCaseOfConstantSwitch() {
        assertThat(apply(simplifier, "{ switch 2 case 1 { sstore(0, 1) } case 2 { sstore(0, 2) } default { } }"))
                .isEqualTo(normalize("{ { sstore(0, 2) } }"));
        assertThat(apply(simplifier, "{ switch 5 case 1 { sstore(0, 1) } default { sstore(0, 3) } }"))
                .isEqualTo(normalize("{ { sstore(0, 3) } }"));
    }

    @Test
    void turnsSingleCaseSwitchIntoIf() {
        assertThat(apply(simplifier, "{ let x := calldataload(0) switch x case 3 { sstore(0, 1) } }"))
                .isEqualTo(normalize("{ let x := calldataload(0) if eq(3, x) { sstore(0, 1) } }"));
    }

    @Test
    void dropsLoopWithFalseConditionButKeepsInit() {
        assertThat(apply(simplifier, "{ for { sstore(0, 1) } 0 { } { sstore(0, 2) } }"))
                .isEqualTo(normalize("{ { sstore(0, 1) } }"));
    }
}
