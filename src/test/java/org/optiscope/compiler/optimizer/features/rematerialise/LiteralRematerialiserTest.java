package org.optiscope.compiler.optimizer.features.rematerialise;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.apply;
import static org.optiscope.compiler.optimizer.OptimizerTestSupport.normalize;

@Tag("unit")
class LiteralRematerialiserTest {

    @Test
    void replacesReferencesToUnassignedLiteralVariables() {
        String result = apply(new LiteralRematerialiser(),
                "{ let a := 5 let b := a a := 2 let c := 7 sstore(c, b) }");

        assertThat(result).isEqualTo(normalize("{ let a := 5 let b := a a := 2 let c := 7 sstore(7, b) }"));
    }
}
