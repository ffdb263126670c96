package com.lodestar.core.emission;

import com.lodestar.core.fact.FactKind;
import com.lodestar.core.fact.Scope;

import java.util.Objects;

/**
 * Declared contract for one emitted fact: its scope, representation kind and
 * whether the action must always produce it.
 */
public record Emission(Scope scope, FactKind kind, boolean required) {

    public Emission {
        Objects.requireNonNull(scope, "Emission must declare a scope");
        Objects.requireNonNull(kind, "Emission must declare a kind");
    }

    public static Emission of(Scope scope) {
        return new Emission(scope, FactKind.FACT, true);
    }

    public static Emission of(Scope scope, FactKind kind) {
        return new Emission(scope, kind, true);
    }

    public static Emission optional(Scope scope, FactKind kind) {
        return new Emission(scope, kind, false);
    }

    public Emission asOptional() {
        return new Emission(scope, kind, false);
    }
}
