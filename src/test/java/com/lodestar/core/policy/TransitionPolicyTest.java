package com.lodestar.core.policy;

import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.phase.PhaseSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransitionPolicyTest {

    private final PhaseSet phases = PhaseSet.create("START", "PLAN", "EXECUTE");

    private final TransitionPolicy policy = TransitionPolicy.of(phases.phase("START"),
            PhaseRule.enter(phases.phase("EXECUTE")).whenAll("plan_ready").build(),
            PhaseRule.enter(phases.phase("PLAN")).whenAll("goal").build());

    @Test
    @DisplayName("first matching rule wins")
    void firstMatchWins() {
        assertEquals(phases.phase("EXECUTE"), policy.derivePhase(Set.of("goal", "plan_ready")));
        assertEquals(phases.phase("PLAN"), policy.derivePhase(Set.of("goal")));
    }

    @Test
    @DisplayName("falls back to the default phase")
    void defaultPhase() {
        assertEquals(phases.phase("START"), policy.derivePhase(Set.of()));
        assertTrue(policy.matchingRule(Set.of("unrelated")).isEmpty());
    }

    @Test
    @DisplayName("derivation is a pure function of the key set")
    void deterministic() {
        Set<String> keys = Set.of("goal");
        assertEquals(policy.derivePhase(keys), policy.derivePhase(Set.copyOf(keys)));
    }

    @Test
    @DisplayName("requires a default phase")
    void requiresDefault() {
        assertThrows(NullPointerException.class, () -> TransitionPolicy.of(null));
    }
}
