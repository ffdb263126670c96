package com.lodestar.core.fact;

import java.util.Objects;

/**
 * The smallest unit of knowledge an agent holds.
 *
 * @param key   fully-qualified key (nested groups joined with {@link Facts#SEPARATOR})
 * @param value tagged payload
 * @param scope lifetime; always explicit
 * @param kind  representation kind declared by the emitting action
 */
public record Fact(String key, FactValue value, Scope scope, FactKind kind) {

    public Fact {
        Objects.requireNonNull(key, "Fact key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Fact key must not be blank");
        }
        Objects.requireNonNull(value, () -> "Fact '" + key + "' value must not be null (use FactValue.NULL)");
        Objects.requireNonNull(scope, () -> "Fact '" + key + "' must declare a scope");
        Objects.requireNonNull(kind, () -> "Fact '" + key + "' must declare a kind");
    }

    public static Fact of(String key, Object value, Scope scope) {
        return new Fact(key, FactValue.of(value), scope, FactKind.FACT);
    }

    public static Fact of(String key, Object value, Scope scope, FactKind kind) {
        return new Fact(key, FactValue.of(value), scope, kind);
    }

    public boolean isDurable() {
        return scope.isDurable();
    }

    public Fact withKey(String newKey) {
        return new Fact(newKey, value, scope, kind);
    }
}
