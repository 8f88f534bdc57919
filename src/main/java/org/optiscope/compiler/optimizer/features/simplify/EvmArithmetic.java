package org.optiscope.compiler.optimizer.features.simplify;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Evaluates pure builtins on 256-bit words with wrap-around semantics.
 */
final class EvmArithmetic {

    static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger MASK = MODULUS.subtract(BigInteger.ONE);
    private static final BigInteger WORD_BITS = BigInteger.valueOf(256);

    private static final Map<String, Function<List<BigInteger>, BigInteger>> OPERATIONS = Map.ofEntries(
            Map.entry("add", a -> wrap(a.get(0).add(a.get(1)))),
            Map.entry("sub", a -> wrap(a.get(0).subtract(a.get(1)))),
            Map.entry("mul", a -> wrap(a.get(0).multiply(a.get(1)))),
            Map.entry("div", a -> a.get(1).signum() == 0 ? BigInteger.ZERO : a.get(0).divide(a.get(1))),
            Map.entry("sdiv", a -> a.get(1).signum() == 0 ? BigInteger.ZERO
                    : wrap(signed(a.get(0)).divide(signed(a.get(1))))),
            Map.entry("mod", a -> a.get(1).signum() == 0 ? BigInteger.ZERO : a.get(0).mod(a.get(1))),
            Map.entry("smod", a -> smod(a.get(0), a.get(1))),
            Map.entry("exp", a -> a.get(0).modPow(a.get(1), MODULUS)),
            Map.entry("signextend", a -> signExtend(a.get(0), a.get(1))),
            Map.entry("lt", a -> bool(a.get(0).compareTo(a.get(1)) < 0)),
            Map.entry("gt", a -> bool(a.get(0).compareTo(a.get(1)) > 0)),
            Map.entry("slt", a -> bool(signed(a.get(0)).compareTo(signed(a.get(1))) < 0)),
            Map.entry("sgt", a -> bool(signed(a.get(0)).compareTo(signed(a.get(1))) > 0)),
            Map.entry("eq", a -> bool(a.get(0).equals(a.get(1)))),
            Map.entry("iszero", a -> bool(a.get(0).signum() == 0)),
            Map.entry("not", a -> a.get(0).xor(MASK)),
            Map.entry("and", a -> a.get(0).and(a.get(1))),
            Map.entry("or", a -> a.get(0).or(a.get(1))),
            Map.entry("xor", a -> a.get(0).xor(a.get(1))),
            Map.entry("byte", a -> byteAt(a.get(0), a.get(1))),
            Map.entry("shl", a -> a.get(0).compareTo(WORD_BITS) >= 0 ? BigInteger.ZERO
                    : wrap(a.get(1).shiftLeft(a.get(0).intValue()))),
            Map.entry("shr", a -> a.get(0).compareTo(WORD_BITS) >= 0 ? BigInteger.ZERO
                    : a.get(1).shiftRight(a.get(0).intValue())),
            Map.entry("sar", a -> sar(a.get(0), a.get(1))),
            Map.entry("addmod", a -> a.get(2).signum() == 0 ? BigInteger.ZERO
                    : a.get(0).add(a.get(1)).mod(a.get(2))),
            Map.entry("mulmod", a -> a.get(2).signum() == 0 ? BigInteger.ZERO
                    : a.get(0).multiply(a.get(1)).mod(a.get(2)))
    );

    private EvmArithmetic() {}

    /**
     * @param function  The builtin name.
     * @param arguments The argument words, in source order.
     * @return The folded value, or empty if the builtin cannot be evaluated at compile time.
     */
    static Optional<BigInteger> evaluate(String function, List<BigInteger> arguments) {
        Function<List<BigInteger>, BigInteger> operation = OPERATIONS.get(function);
        return operation == null ? Optional.empty() : Optional.of(operation.apply(arguments));
    }

    static BigInteger wrap(BigInteger value) {
        return value.mod(MODULUS);
    }

    private static BigInteger signed(BigInteger word) {
        return word.testBit(255) ? word.subtract(MODULUS) : word;
    }

    private static BigInteger bool(boolean value) {
        return value ? BigInteger.ONE : BigInteger.ZERO;
    }

    private static BigInteger smod(BigInteger a, BigInteger b) {
        if (b.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger sa = signed(a);
        BigInteger remainder = sa.abs().mod(signed(b).abs());
        return wrap(sa.signum() < 0 ? remainder.negate() : remainder);
    }

    private static BigInteger signExtend(BigInteger bytePosition, BigInteger value) {
        if (bytePosition.compareTo(BigInteger.valueOf(31)) >= 0) {
            return value;
        }
        int bit = bytePosition.intValue() * 8 + 7;
        BigInteger lowMask = BigInteger.ONE.shiftLeft(bit + 1).subtract(BigInteger.ONE);
        return value.testBit(bit) ? value.or(MASK.xor(lowMask)) : value.and(lowMask);
    }

    private static BigInteger byteAt(BigInteger index, BigInteger value) {
        if (index.compareTo(BigInteger.valueOf(32)) >= 0) {
            return BigInteger.ZERO;
        }
        return value.shiftRight(8 * (31 - index.intValue())).and(BigInteger.valueOf(0xff));
    }

    private static BigInteger sar(BigInteger shift, BigInteger value) {
        boolean negative = value.testBit(255);
        if (shift.compareTo(WORD_BITS) >= 0) {
            return negative ? MASK : BigInteger.ZERO;
        }
        return wrap(signed(value).shiftRight(shift.intValue()));
    }
}
