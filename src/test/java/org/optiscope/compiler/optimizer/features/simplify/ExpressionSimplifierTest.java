package org.optiscope.compiler.optimizer.features.simplify;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.apply;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.normalize;

@Tag("unit")
class ExpressionSimplifierTest {

    private final ExpressionSimplifier simplifier = new ExpressionSimplifier();

    @Test
    void foldsConstantArithmetic() {
        assertThat(apply(simplifier, "{ sstore(0, add(2, mul(3, 4))) }"))
                .isEqualTo(normalize("{ sstore(0, 14) }"));
    }

    @Test
    void wrapsAroundAt256Bits() {
        assertThat(apply(simplifier, "{ sstore(0, sub(0, 1)) }"))
                .isEqualTo(normalize("{ sstore(0, 0x" + "f".repeat(64) + ") }"));
    }

    @Test
    void divisionByZeroFoldsToZero() {
        assertThat(apply(simplifier, "{ sstore(0, div(1, 0)) }")).isEqualTo(normalize("{ sstore(0, 0) }"));
    }

    @Test
    void appliesNeutralElementRules() {
        String result = apply(simplifier, "{ let x := calldataload(0) sstore(add(x, 0), mul(1, x)) }");

        assertThat(result).isEqualTo(normalize("{ let x := calldataload(0) sstore(x, x) }"));
    }

    @Test
    void keepsOperandWithSideEffectsOrStateDependence() {
        assertThat(apply(simplifier, "{ sstore(0, mul(sload(0), 0)) }"))
                .isEqualTo(normalize("{ sstore(0, mul(sload(0), 0)) }"));
    }

    @Test
    void collapsesTripleNegation() {
        assertThat(apply(simplifier, "{ let x := calldataload(0) sstore(0, iszero(iszero(iszero(x)))) }"))
                .isEqualTo(normalize("{ let x := calldataload(0) sstore(0, iszero(x)) }"));
    }

    @Test
    void leavesCallsWithWrongArityAlone() {
        assertThat(apply(simplifier, "{ sstore(0, add(1)) }")).isEqualTo(normalize("{ sstore(0, add(1)) }"));
    }

    @Test
    void evaluatesSignedOperations() {
        BigInteger minusOne = EvmArithmetic.wrap(BigInteger.ONE.negate());

        assertThat(EvmArithmetic.evaluate("slt", List.of(minusOne, BigInteger.ZERO))).contains(BigInteger.ONE);
        assertThat(EvmArithmetic.evaluate("sdiv", List.of(minusOne, BigInteger.ONE))).contains(minusOne);
        assertThat(EvmArithmetic.evaluate("sload", List.of(BigInteger.ZERO))).isEmpty();
    }
}
