package org.optiscope.compiler.printer;

import org.optiscope.compiler.object.DataNode;
import org.optiscope.compiler.object.IObjectEntry;
import org.optiscope.compiler.object.ObjectNode;

/**
 * Renders an object tree in full object notation, including nested objects and data sections.
 */
public class ObjectPrinter {

    private static final String INDENT = "    ";

    private final AsmPrinter asmPrinter;

    public ObjectPrinter(AsmPrinter asmPrinter) {
        this.asmPrinter = asmPrinter;
    }

    public ObjectPrinter() {
        this(new AsmPrinter());
    }

    public String print(ObjectNode object) {
        StringBuilder out = new StringBuilder();
        out.append("object \"").append(object.name()).append("\" {\n");
        out.append(INDENT).append("code ").append(indent(asmPrinter.print(object.getCode()))).append('\n');
        for (IObjectEntry entry : object.getEntries()) {
            String rendered = entry instanceof ObjectNode child
                    ? print(child)
                    : "data \"" + entry.name() + "\" hex\"" + ((DataNode) entry).toHex() + "\"";
            out.append(INDENT).append(indent(rendered)).append('\n');
        }
        out.append('}');
        return out.toString();
    }

    private static String indent(String text) {
        return text.replace("\n", "\n" + INDENT);
    }
}
