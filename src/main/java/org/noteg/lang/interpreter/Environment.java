package org.noteg.lang.interpreter;

import io.vavr.control.Option;

import java.util.HashMap;
import java.util.Map;

/**
 * One scope of name bindings with an optional enclosing scope.
 *
 * <p>Each call and block owns its own environment; the parent link is only read for lookup.
 * Closures keep their defining environment alive by holding it.
 */
public final class Environment {
    private final Environment parent;
    private final Map<String, Value> values = new HashMap<>();

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public static Environment root() {
        return new Environment(null);
    }

    public Environment child() {
        return new Environment(this);
    }

    /**
     * Bind {@code name} in this scope, replacing any existing local binding.
     */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    /**
     * Innermost binding of {@code name}, searching outwards through enclosing scopes.
     */
    public Option<Value> lookup(String name) {
        for (var scope = this; scope != null; scope = scope.parent) {
            var value = scope.values.get(name);
            if (value != null) {
                return Option.some(value);
            }
        }
        return Option.none();
    }

    public Option<Value> lookupLocal(String name) {
        return Option.of(values.get(name));
    }
}
