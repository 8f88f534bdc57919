package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * A number, boolean or string literal.
 *
 * @param kind     The literal kind.
 * @param value    For numbers the source spelling (decimal or {@code 0x} hex), for booleans
 *                 {@code true}/{@code false}, for strings the unescaped text.
 * @param location The source position.
 */
public record Literal(LiteralKind kind, String value, SourceLocation location) implements Expression {

    public static Literal number(BigInteger value, SourceLocation location) {
        String text = value.bitLength() <= 16 ? value.toString() : "0x" + value.toString(16);
        return new Literal(LiteralKind.NUMBER, text, location);
    }

    public static Literal number(long value, SourceLocation location) {
        return number(BigInteger.valueOf(value), location);
    }

    /**
     * Returns the numeric value of this literal as a 256-bit word.
     * Strings are left-aligned into the word the way the EVM dialect stores them.
     */
    public BigInteger numericValue() {
        return switch (kind) {
            case NUMBER -> value.startsWith("0x")
                    ? new BigInteger(value.substring(2), 16)
                    : new BigInteger(value);
            case BOOLEAN -> "true".equals(value) ? BigInteger.ONE : BigInteger.ZERO;
            case STRING -> {
                byte[] bytes = value.getBytes(StandardCharsets.ISO_8859_1);
                byte[] word = new byte[33];
                System.arraycopy(bytes, 0, word, 1, Math.min(32, bytes.length));
                yield new BigInteger(word);
            }
        };
    }

    public boolean isZero() {
        return numericValue().signum() == 0;
    }
}
