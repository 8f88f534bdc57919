package org.optiscope.driver;

import org.optiscope.compiler.frontend.parser.ObjectParser;
import org.optiscope.compiler.object.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SubObjectResolverTest {

    private final ObjectNode root = new ObjectParser().parse(ObjectTreeWalkerTest.TREE, "tree.yul").root();
    private final SubObjectResolver resolver = new SubObjectResolver();

    @Test
    void resolvesNestedPath() {
        assertThat(resolver.resolve(root, "A.B.C").name()).isEqualTo("C");
    }

    @Test
    void rootNameResolvesToRoot() {
        assertThat(resolver.resolve(root, "A")).isSameAs(root);
    }

    @Test
    void missingSegmentIsConfigurationError() {
        assertThatThrownBy(() -> resolver.resolve(root, "A.X"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'X' not found in 'A'");
    }

    @Test
    void pathMustStartWithRootName() {
        assertThatThrownBy(() -> resolver.resolve(root, "B.C"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("does not start with the root object 'A'");
    }

    @Test
    void dataSectionIsNotAnObject() {
        assertThatThrownBy(() -> resolver.resolve(root, "A.B.table"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("data section");
    }

    @Test
    void emptyPathIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(root, ""))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> resolver.resolve(root, "A..B"))
                .isInstanceOf(ConfigurationException.class);
    }
}
