package org.optiscope.compiler.object;

import java.util.HexFormat;

/**
 * A named data section of an object. Data never carries code and is never transformed.
 *
 * @param name The data name.
 * @param data The raw bytes.
 */
public record DataNode(String name, byte[] data) implements IObjectEntry {

    public DataNode {
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public String toHex() {
        return HexFormat.of().formatHex(data);
    }
}
