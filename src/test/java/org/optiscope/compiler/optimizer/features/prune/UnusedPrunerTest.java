package org.optiscope.compiler.optimizer.features.prune;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.apply;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.normalize;

@Tag("unit")
class UnusedPrunerTest {

    private final UnusedPruner pruner = new UnusedPruner();

    @Test
    void removesUnusedDeclarationsAndFunctionsToFixedPoint() {
        String result = apply(pruner, "{ let a := 1 let b := a function f() { } sstore(0, 0) }");

        assertThat(result).isEqualTo(normalize("{ sstore(0, 0) }"));
    }

    @Test
    void keepsSideEffectsOfUnusedValueThroughPop() {
        String result = apply(pruner, "{ function f() -> r { sstore(0, 1) } let c := f() }");

        assertThat(result).isEqualTo(normalize("{ function f() -> r { sstore(0, 1) } pop(f()) }"));
    }

    @Test
    void removesSideEffectFreeExpressionStatements() {
        assertThat(apply(pruner, "{ pop(calldataload(0)) mstore(0, 1) }"))
                .isEqualTo(normalize("{ mstore(0, 1) }"));
    }

    @Test
    void keepsMultiValueDeclarationWithSideEffects() {
        String source = "{ function f() -> a, b { sstore(0, 1) } let x, y := f() }";

        assertThat(apply(pruner, source)).isEqualTo(normalize(source));
    }
}
