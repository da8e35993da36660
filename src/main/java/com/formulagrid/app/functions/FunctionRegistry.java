package com.formulagrid.app.functions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Case-insensitive table of formula functions.
 * Entries are only ever added: registering a name twice fails, nothing is removed.
 */
public class FunctionRegistry {

    private final Map<String, RegisteredFunction> functions = new ConcurrentHashMap<>();

    /**
     * The process-wide registry holding every built-in function.
     * Built once on first access.
     */
    public static FunctionRegistry standard() {
        return StandardHolder.INSTANCE;
    }

    /**
     * A fresh registry populated with the built-ins, for callers that add their own functions.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        AggregateFunctions.registerAll(registry);
        MathFunctions.registerAll(registry);
        TextFunctions.registerAll(registry);
        LogicFunctions.registerAll(registry);
        BridgeFunctions.registerAll(registry);
        return registry;
    }

    /**
     * @throws IllegalStateException if the name is already registered
     */
    public void register(FunctionMetadata metadata, FormulaFunction implementation) {
        RegisteredFunction entry = new RegisteredFunction(metadata, implementation);
        RegisteredFunction existing = functions.putIfAbsent(metadata.getName(), entry);
        if (existing != null) {
            throw new IllegalStateException("Function already registered: " + metadata.getName());
        }
    }

    /**
     * Returns the function for a name in any case, or null.
     */
    public RegisteredFunction lookup(String name) {
        if (name == null) {
            return null;
        }
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public int size() {
        return functions.size();
    }

    /**
     * All metadata sorted by name.
     */
    public List<FunctionMetadata> getAllMetadata() {
        List<FunctionMetadata> all = new ArrayList<>();
        for (RegisteredFunction function : functions.values()) {
            all.add(function.getMetadata());
        }
        all.sort(Comparator.comparing(FunctionMetadata::getName));
        return all;
    }

    private static final class StandardHolder {
        private static final FunctionRegistry INSTANCE = withBuiltins();
    }
}
