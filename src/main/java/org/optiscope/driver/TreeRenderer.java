package org.optiscope.driver;

import org.optiscope.compiler.printer.AsmPrinter;
import org.optiscope.compiler.printer.ObjectPrinter;

/**
 * Renders the session tree: only the code block if the input was a bare block, the full object
 * notation otherwise.
 */
public class TreeRenderer {

    private final AsmPrinter asmPrinter = new AsmPrinter();
    private final ObjectPrinter objectPrinter = new ObjectPrinter(asmPrinter);

    public String render(SessionState state) {
        if (state.isCodeBlockInput()) {
            return asmPrinter.print(state.getRoot().getCode());
        }
        return objectPrinter.print(state.getRoot());
    }
}
