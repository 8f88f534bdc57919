package org.optiscope.driver;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.model.SourceLocation;
import org.optiscope.compiler.optimizer.OptimiserSettings;
import org.optiscope.compiler.optimizer.StepDescriptor;
import org.optiscope.compiler.optimizer.StepRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.contextFor;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.normalize;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.parse;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.print;

@Tag("unit")
class StepSequenceTest {

    private final StepRegistry registry = StepRegistry.initializeWithDefaults();

    private static List<Character> codes(StepSequence sequence) {
        List<Character> codes = new ArrayList<>();
        sequence.getElements().forEach(e -> e.steps().forEach(s -> codes.add(s.abbreviation())));
        return codes;
    }

    @Test
    void ignoresWhitespace() {
        StepSequence sequence = StepSequence.parse(" d h\tf\n", registry);

        assertThat(codes(sequence)).containsExactly('d', 'h', 'f');
        assertThat(sequence.getElements()).noneMatch(StepSequence.Element::repeated);
    }

    @Test
    void bracketsFormOneRepeatedElement() {
        StepSequence sequence = StepSequence.parse("d[xsu]f", registry);

        assertThat(sequence.getElements()).hasSize(3);
        assertThat(sequence.getElements().get(1).repeated()).isTrue();
        assertThat(sequence.getElements().get(1).steps()).extracting(StepDescriptor::abbreviation)
                .containsExactly('x', 's', 'u');
    }

    @Test
    void unknownCodeRejectsWholeSequence() {
        assertThatThrownBy(() -> StepSequence.parse("dq", registry))
                .isInstanceOf(UnknownStepException.class)
                .hasMessage("Unknown step code 'q'")
                .extracting(e -> ((UnknownStepException) e).getCode()).isEqualTo('q');
    }

    @Test
    void malformedBracketsAreConfigurationErrors() {
        assertThatThrownBy(() -> StepSequence.parse("[d[x]]", registry))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("Nested");
        assertThatThrownBy(() -> StepSequence.parse("[dx", registry))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("Unbalanced '['");
        assertThatThrownBy(() -> StepSequence.parse("dx]", registry))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("Unbalanced ']'");
        assertThatThrownBy(() -> StepSequence.parse("d[]", registry))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("Empty");
    }

    @Test
    void emptySequenceIsAllowed() {
        assertThat(StepSequence.parse("  ", registry).isEmpty()).isTrue();
    }

    @Test
    void reportsWhetherAnyStepNeedsUniqueNames() {
        assertThat(StepSequence.parse("ds", registry).requiresDisambiguation()).isFalse();
        assertThat(StepSequence.parse("d[sx]", registry).requiresDisambiguation()).isTrue();
    }

    @Test
    void appliesStepsInOrder() {
        Block code = parse("{ let x := add(1, 2) sstore(0, x) }");

        Block result = StepSequence.parse("s", registry).apply(contextFor(code), code);

        assertThat(print(result)).isEqualTo(normalize("{ let x := 3 sstore(0, x) }"));
    }

    @Test
    void repetitionStopsAtFixedPoint() {
        AtomicInteger calls = new AtomicInteger();
        StepRegistry counting = new StepRegistry();
        counting.register(new StepDescriptor('c', "Counting", false, (context, block) -> {
            calls.incrementAndGet();
            return block;
        }));
        Block code = parse("{ }");

        StepSequence.parse("[c]", counting).apply(contextFor(code), code);

        assertThat(calls).hasValue(1);
    }

    @Test
    void repetitionIsBoundedByMaxRounds() {
        AtomicInteger calls = new AtomicInteger();
        StepRegistry growing = new StepRegistry();
        growing.register(new StepDescriptor('g', "Growing", false, (context, block) -> {
            calls.incrementAndGet();
            List<Statement> statements = new ArrayList<>(block.statements());
            statements.add(new ExpressionStatement(new FunctionCall(
                    new Identifier("stop", SourceLocation.NONE), List.of(), SourceLocation.NONE), SourceLocation.NONE));
            return new Block(statements, block.location());
        }));
        Block code = parse("{ }");

        Block result = StepSequence.parse("[g]", growing)
                .apply(contextFor(code, new OptimiserSettings(3, 16, 16)), code);

        assertThat(calls).hasValue(3);
        assertThat(result.statements()).hasSize(3);
    }
}
