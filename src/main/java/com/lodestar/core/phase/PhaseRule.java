package com.lodestar.core.phase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Declarative rule for entering a phase, evaluated against the keys of the
 * durable fact set.
 *
 * @param enter    phase entered when the rule matches
 * @param whenAll  keys that must all be present
 * @param whenAny  keys of which at least one must be present (ignored when empty)
 * @param whenNone keys that must all be absent
 */
public record PhaseRule(Phase enter, Set<String> whenAll, Set<String> whenAny, Set<String> whenNone) {

    public PhaseRule {
        Objects.requireNonNull(enter, "PhaseRule must name the phase it enters");
        whenAll = sorted(whenAll);
        whenAny = sorted(whenAny);
        whenNone = sorted(whenNone);
    }

    public static Builder enter(Phase phase) {
        return new Builder(phase);
    }

    public boolean matches(Set<String> keys) {
        if (!keys.containsAll(whenAll)) {
            return false;
        }
        if (!whenAny.isEmpty() && Collections.disjoint(keys, whenAny)) {
            return false;
        }
        return Collections.disjoint(keys, whenNone);
    }

    /** Every key this rule inspects. */
    public Set<String> referencedKeys() {
        var all = new TreeSet<String>(whenAll);
        all.addAll(whenAny);
        all.addAll(whenNone);
        return Collections.unmodifiableSet(all);
    }

    /**
     * Compact condition text, e.g. {@code a & b & (c | d) & !e}.
     */
    public String describeCondition() {
        var parts = new ArrayList<String>();
        if (!whenAll.isEmpty()) {
            parts.add(String.join(" & ", whenAll));
        }
        if (!whenAny.isEmpty()) {
            parts.add("(" + String.join(" | ", whenAny) + ")");
        }
        if (!whenNone.isEmpty()) {
            parts.add("!" + String.join(" & !", whenNone));
        }
        return parts.isEmpty() ? "true" : String.join(" & ", parts);
    }

    @Override
    public String toString() {
        return "PhaseRule(enter=" + enter.name() + " when " + describeCondition() + ")";
    }

    private static Set<String> sorted(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new TreeSet<>(keys));
    }

    public static final class Builder {

        private final Phase enter;
        private Set<String> whenAll = Set.of();
        private Set<String> whenAny = Set.of();
        private Set<String> whenNone = Set.of();

        private Builder(Phase enter) {
            this.enter = enter;
        }

        public Builder whenAll(String... keys) {
            this.whenAll = Set.copyOf(Arrays.asList(keys));
            return this;
        }

        public Builder whenAny(String... keys) {
            this.whenAny = Set.copyOf(Arrays.asList(keys));
            return this;
        }

        public Builder whenNone(String... keys) {
            this.whenNone = Set.copyOf(Arrays.asList(keys));
            return this;
        }

        public PhaseRule build() {
            return new PhaseRule(enter, whenAll, whenAny, whenNone);
        }
    }
}
