package io.monkeylang.eval;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name-to-value bindings for evaluation. A scope may be enclosed by an outer one; lookups
 * fall through to it, bindings always land in the receiving scope.
 * <p>
 * A name may be bound to no value ({@code null}), e.g. the result of an empty block.
 */
public class Environment {
    private final Map<String, Value> store = new HashMap<>();
    private final Environment outer;

    public Environment() {
        this.outer = null;
    }

    /** Scope enclosed by {@code outer}; reserved for a future function-call mechanism. */
    public Environment(Environment outer) {
        this.outer = Objects.requireNonNull(outer, "outer");
    }

    /** Whether {@code name} is bound here or in an outer scope, even to no value. */
    public boolean has(String name) {
        if (store.containsKey(name)) return true;
        return outer != null && outer.has(name);
    }

    /** The bound value; empty when the name is missing or bound to no value. */
    public Optional<Value> get(String name) {
        if (store.containsKey(name)) return Optional.ofNullable(store.get(name));
        if (outer != null) return outer.get(name);
        return Optional.empty();
    }

    public Value set(String name, Value value) {
        store.put(Objects.requireNonNull(name, "name"), value);
        return value;
    }
}
