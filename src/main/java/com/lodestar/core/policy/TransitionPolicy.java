package com.lodestar.core.policy;

import com.lodestar.core.phase.Phase;
import com.lodestar.core.phase.PhaseRule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered phase rules plus a mandatory default phase.
 * <p>
 * {@link #derivePhase(Set)} is a pure function of the durable key set: the
 * first matching rule wins, otherwise the default applies. Rule overlaps are
 * rejected when the agent spec is built, so declared order only ever
 * separates a specific rule from its fallback.
 */
public record TransitionPolicy(List<PhaseRule> rules, Phase defaultPhase) {

    public TransitionPolicy {
        rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        Objects.requireNonNull(defaultPhase, "TransitionPolicy requires a default phase");
    }

    public static TransitionPolicy of(Phase defaultPhase, PhaseRule... rules) {
        return new TransitionPolicy(List.of(rules), defaultPhase);
    }

    public Phase derivePhase(Set<String> durableKeys) {
        return matchingRule(durableKeys).map(PhaseRule::enter).orElse(defaultPhase);
    }

    public Optional<PhaseRule> matchingRule(Set<String> durableKeys) {
        for (PhaseRule rule : rules) {
            if (rule.matches(durableKeys)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
