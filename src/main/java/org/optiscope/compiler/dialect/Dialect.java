package org.optiscope.compiler.dialect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The set of builtin functions and reserved words that code is analyzed and transformed against.
 * A single dialect instance is fixed for a whole session.
 */
public final class Dialect {

    private static final Set<String> KEYWORDS = Set.of(
            "let", "function", "if", "switch", "case", "default", "for",
            "break", "continue", "leave", "true", "false", "hex");

    private final String name;
    private final Map<String, BuiltinFunction> builtins;

    private Dialect(String name, Map<String, BuiltinFunction> builtins) {
        this.name = name;
        this.builtins = Collections.unmodifiableMap(builtins);
    }

    public String getName() {
        return name;
    }

    public Optional<BuiltinFunction> builtin(String functionName) {
        return Optional.ofNullable(builtins.get(functionName));
    }

    public boolean isBuiltin(String functionName) {
        return builtins.containsKey(functionName);
    }

    public boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    public Map<String, BuiltinFunction> getBuiltins() {
        return builtins;
    }

    /**
     * Creates the EVM-flavoured dialect used by the explorer.
     * @return A new dialect instance.
     */
    public static Dialect evm() {
        Map<String, BuiltinFunction> b = new LinkedHashMap<>();
        // Pure arithmetic and bitwise operations
        for (String op : new String[]{"add", "sub", "mul", "div", "sdiv", "mod", "smod", "exp", "signextend",
                "lt", "gt", "slt", "sgt", "eq", "and", "or", "xor", "byte", "shl", "shr", "sar"}) {
            pure(b, op, 2);
        }
        pure(b, "not", 1);
        pure(b, "iszero", 1);
        pure(b, "addmod", 3);
        pure(b, "mulmod", 3);

        // Environment reads that do not change during execution
        for (String op : new String[]{"address", "caller", "callvalue", "calldatasize", "codesize",
                "origin", "gasprice", "chainid", "coinbase", "timestamp", "number"}) {
            pure(b, op, 0);
        }
        pure(b, "calldataload", 1);

        // Reads of mutable state
        reader(b, "mload", 1);
        reader(b, "sload", 1);
        reader(b, "keccak256", 2);
        reader(b, "balance", 1);
        reader(b, "msize", 0);
        reader(b, "gas", 0);
        reader(b, "returndatasize", 0);

        // Writes and external effects
        effect(b, "mstore", 2, 0);
        effect(b, "mstore8", 2, 0);
        effect(b, "sstore", 2, 0);
        effect(b, "calldatacopy", 3, 0);
        effect(b, "codecopy", 3, 0);
        effect(b, "returndatacopy", 3, 0);
        effect(b, "datacopy", 3, 0);
        effect(b, "log0", 2, 0);
        effect(b, "log1", 3, 0);
        effect(b, "log2", 4, 0);
        effect(b, "call", 7, 1);
        effect(b, "staticcall", 6, 1);
        effect(b, "delegatecall", 6, 1);
        effect(b, "create", 3, 1);

        b.put("pop", new BuiltinFunction("pop", 1, 0, true, true, false, false));

        // Terminating
        terminating(b, "stop", 0);
        terminating(b, "return", 2);
        terminating(b, "revert", 2);
        terminating(b, "invalid", 0);

        // Object access
        b.put("datasize", new BuiltinFunction("datasize", 1, 1, true, true, false, true));
        b.put("dataoffset", new BuiltinFunction("dataoffset", 1, 1, true, true, false, true));

        return new Dialect("evm", b);
    }

    private static void pure(Map<String, BuiltinFunction> b, String name, int params) {
        b.put(name, new BuiltinFunction(name, params, 1, true, true, false, false));
    }

    private static void reader(Map<String, BuiltinFunction> b, String name, int params) {
        b.put(name, new BuiltinFunction(name, params, 1, false, true, false, false));
    }

    private static void effect(Map<String, BuiltinFunction> b, String name, int params, int returns) {
        b.put(name, new BuiltinFunction(name, params, returns, false, false, false, false));
    }

    private static void terminating(Map<String, BuiltinFunction> b, String name, int params) {
        b.put(name, new BuiltinFunction(name, params, 0, false, false, true, false));
    }
}
