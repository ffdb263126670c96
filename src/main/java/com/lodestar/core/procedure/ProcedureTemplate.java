package com.lodestar.core.procedure;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of actions run for one phase.
 */
public record ProcedureTemplate(String name, List<Action> actions) {

    public ProcedureTemplate {
        Objects.requireNonNull(name, "ProcedureTemplate name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("ProcedureTemplate name must not be blank");
        }
        actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
    }

    public static ProcedureTemplate of(String name, Action... actions) {
        return new ProcedureTemplate(name, List.of(actions));
    }

    public static ProcedureTemplate empty(String name) {
        return new ProcedureTemplate(name, List.of());
    }

    @Override
    public String toString() {
        return "ProcedureTemplate(" + name + ", " + actions.stream().map(Action::name).toList() + ")";
    }
}
