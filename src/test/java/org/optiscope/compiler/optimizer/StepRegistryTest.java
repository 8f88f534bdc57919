package org.optiscope.compiler.optimizer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StepRegistryTest {

    @Test
    void defaultsRegisterAllBuiltInSteps() {
        StepRegistry registry = StepRegistry.initializeWithDefaults();

        assertThat(registry.getSteps()).extracting(StepDescriptor::abbreviation)
                .containsExactly('f', 'g', 'h', 'd', 's', 'x', 'u', 'D', 'n', 'o', 'I', 'O', 'T');
        assertThat(registry.resolve('x')).get().extracting(StepDescriptor::name).isEqualTo("ExpressionSplitter");
        assertThat(registry.resolve('x').orElseThrow().requiresDisambiguation()).isTrue();
        assertThat(registry.resolve('s').orElseThrow().requiresDisambiguation()).isFalse();
    }

    @Test
    void controlCodesAreNotRegistered() {
        StepRegistry registry = StepRegistry.initializeWithDefaults();

        assertThat(registry.contains('#')).isFalse();
        assertThat(registry.contains(',')).isFalse();
        assertThat(registry.contains(';')).isFalse();
        assertThat(registry.resolve('z')).isEmpty();
    }

    @Test
    void rejectsDuplicateCodes() {
        StepRegistry registry = new StepRegistry();
        registry.register(new StepDescriptor('a', "First", false, (context, code) -> code));

        assertThatThrownBy(() -> registry.register(new StepDescriptor('a', "Second", false, (context, code) -> code)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("First");
    }
}
