package org.optiscope.compiler.optimizer.features.cleanup;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.contextFor;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.normalize;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.parse;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.print;

@Tag("unit")
class VarNameCleanerTest {

    private static String clean(String source) {
        Block code = parse(source);
        return print(new VarNameCleaner().run(contextFor(code), code));
    }

    @Test
    void stripsNumericSuffixes() {
        assertThat(VarNameCleaner.stripSuffix("x_1")).isEqualTo("x");
        assertThat(VarNameCleaner.stripSuffix("a_1_2")).isEqualTo("a");
        assertThat(VarNameCleaner.stripSuffix("_1")).isEqualTo("_1");
        assertThat(VarNameCleaner.stripSuffix("x_y")).isEqualTo("x_y");
    }

    @Test
    void choosesShortestFreeNamePerRegion() {
        String result = clean("""
                {
                    let x_1 := 1
                    let x_2 := 2
                    sstore(x_1, x_2)
                    function f(a_7) -> r_3 { let x_4 := a_7 r_3 := x_4 }
                }""");

        assertThat(result).isEqualTo(normalize("""
                {
                    let x := 1
                    let x_1 := 2
                    sstore(x, x_1)
                    function f(a) -> r { let x_2 := a r := x_2 }
                }"""));
    }

    @Test
    void separateFunctionsMayReuseNames() {
        String result = clean("{ function f(a_1) { } function g(a_2) { } }");

        assertThat(result).isEqualTo(normalize("{ function f(a) { } function g(a) { } }"));
    }

    @Test
    void neverPicksFunctionOrBuiltinNames() {
        String result = clean("{ let x_1 := 1 let add_5 := 2 function x() { } sstore(x_1, add_5) }");

        assertThat(result).isEqualTo(normalize("{ let x_1 := 1 let add_1 := 2 function x() { } sstore(x_1, add_1) }"));
    }
}
