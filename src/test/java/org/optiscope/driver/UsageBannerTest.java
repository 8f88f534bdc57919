package org.optiscope.driver;

import org.optiscope.compiler.optimizer.StepDescriptor;
import org.optiscope.compiler.optimizer.StepRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class UsageBannerTest {

    private static StepRegistry registryOf(char... codes) {
        StepRegistry registry = new StepRegistry();
        for (char code : codes) {
            String name = code == 'a' ? "Alpha" : code == 'b' ? "Beta" : "Step" + code;
            registry.register(new StepDescriptor(code, name, false, (context, block) -> block));
        }
        return registry;
    }

    @Test
    void laysOutOptionsColumnByColumnSortedByName() {
        String banner = UsageBanner.render(registryOf('a', 'b'), InteractiveSession.controlCodes(), 2);

        assertThat(banner).isEqualTo(
                "#: >>> QUIT <<<    ;: StackCompressor \n"
                        + "a: Alpha           ,: VarNameCleaner  \n"
                        + "b: Beta            \n");
    }

    @Test
    void singleColumnListsEveryOptionOnItsOwnRow() {
        String banner = UsageBanner.render(registryOf('a'), Map.of('#', "Quit"), 1);

        assertThat(banner).isEqualTo("a: Alpha \n#: Quit  \n");
    }

    @Test
    void equalNamesAreOrderedByCode() {
        StepRegistry registry = new StepRegistry();
        registry.register(new StepDescriptor('z', "Same", false, (context, block) -> block));
        registry.register(new StepDescriptor('c', "Same", false, (context, block) -> block));

        assertThat(UsageBanner.render(registry, Map.of(), 4)).isEqualTo("c: Same z: Same \n");
    }

    @Test
    void namesAreOrderedIgnoringCase() {
        StepRegistry registry = new StepRegistry();
        registry.register(new StepDescriptor('b', "Beta", false, (context, block) -> block));
        registry.register(new StepDescriptor('a', "alpha", false, (context, block) -> block));

        String banner = UsageBanner.render(registry, Map.of(), 4);

        assertThat(banner.indexOf("a: alpha")).isNotNegative().isLessThan(banner.indexOf("b: Beta"));
    }

    @Test
    void equalNamesAreOrderedByCodeIgnoringCase() {
        StepRegistry registry = new StepRegistry();
        registry.register(new StepDescriptor('B', "Same", false, (context, block) -> block));
        registry.register(new StepDescriptor('a', "Same", false, (context, block) -> block));

        String banner = UsageBanner.render(registry, Map.of(), 4);

        assertThat(banner.indexOf("a: Same")).isNotNegative().isLessThan(banner.indexOf("B: Same"));
    }

    @Test
    void defaultMenuContainsEveryStepAndControlCode() {
        StepRegistry registry = StepRegistry.initializeWithDefaults();

        String banner = UsageBanner.render(registry, InteractiveSession.controlCodes(), 4);

        for (StepDescriptor step : registry.getSteps()) {
            assertThat(banner).contains(step.abbreviation() + ": " + step.name());
        }
        assertThat(banner).contains("#: >>> QUIT <<<", ",: VarNameCleaner", ";: StackCompressor");
        assertThat(banner.lines()).hasSize((registry.getSteps().size() + 3 - 1) / 4 + 1);
    }

    @Test
    void controlCodeThatIsAlsoAStepCodeIsAnInvariantViolation() {
        StepRegistry registry = new StepRegistry();
        registry.register(new StepDescriptor('#', "Hash", false, (context, block) -> block));

        assertThatThrownBy(() -> UsageBanner.render(registry, InteractiveSession.controlCodes(), 4))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("#");
    }

    @Test
    void rejectsNonPositiveColumnCount() {
        assertThatThrownBy(() -> UsageBanner.render(new StepRegistry(), Map.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
