package com.lodestar.core.validation;

import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.phase.PhaseSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleOverlapCheckerTest {

    private final PhaseSet phases = PhaseSet.create("START", "PLAN", "EXECUTE", "REVIEW");
    private final RuleOverlapChecker checker = new RuleOverlapChecker();

    private PhaseRule.Builder enter(String phase) {
        return PhaseRule.enter(phases.phase(phase));
    }

    @Nested
    @DisplayName("accepts")
    class Accepts {

        @Test
        @DisplayName("rules that can never match the same state")
        void disjointRules() {
            List<ValidationIssue> issues = checker.check(List.of(
                    enter("PLAN").whenAll("goal").whenNone("plan").build(),
                    enter("EXECUTE").whenAll("plan").build()));

            assertTrue(issues.isEmpty(), issues::toString);
        }

        @Test
        @DisplayName("a specific rule placed before its fallback")
        void orderedFallback() {
            List<ValidationIssue> issues = checker.check(List.of(
                    enter("REVIEW").whenAll("plan", "executed").build(),
                    enter("EXECUTE").whenAll("plan").build()));

            assertTrue(issues.isEmpty(), issues::toString);
        }

        @Test
        @DisplayName("overlapping rules that enter the same phase")
        void samePhase() {
            assertTrue(checker.check(List.of(
                    enter("PLAN").whenAll("a").build(),
                    enter("PLAN").whenAll("b").build())).isEmpty());
        }

        @Test
        @DisplayName("whenAny rules refined by a whenAll rule")
        void anyFallback() {
            assertTrue(checker.check(List.of(
                    enter("REVIEW").whenAll("x").build(),
                    enter("EXECUTE").whenAny("x", "y").build())).isEmpty());
        }
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        @DisplayName("conflicting rules where neither refines the other")
        void conflicting() {
            List<ValidationIssue> issues = checker.check(List.of(
                    enter("PLAN").whenAll("goal").build(),
                    enter("EXECUTE").whenAll("plan").build()));

            assertEquals(1, issues.size());
            ValidationIssue issue = issues.get(0);
            assertTrue(issue.isError());
            assertEquals(ValidationIssue.Category.RULE_OVERLAP, issue.category());
            assertTrue(issue.subject().startsWith("rules[1] (enter EXECUTE"));
            assertTrue(issue.message().startsWith("ambiguous overlap with rules[0]"));
        }

        @Test
        @DisplayName("a later rule shadowed by a broader earlier one")
        void shadowed() {
            List<ValidationIssue> issues = checker.check(List.of(
                    enter("EXECUTE").whenAll("plan").build(),
                    enter("REVIEW").whenAll("plan", "executed").build()));

            assertEquals(1, issues.size());
            assertTrue(issues.get(0).message().startsWith("unreachable"));
        }

        @Test
        @DisplayName("a rule whose conditions contradict each other")
        void contradictory() {
            List<ValidationIssue> issues = checker.check(List.of(
                    enter("PLAN").whenAll("a").whenNone("a").build()));

            assertEquals(1, issues.size());
            assertTrue(issues.get(0).message().startsWith("rule can never match"));
        }

        @Test
        @DisplayName("an unconditional rule shadows everything after it")
        void unconditional() {
            List<ValidationIssue> issues = checker.check(List.of(
                    enter("PLAN").build(),
                    enter("EXECUTE").whenAll("plan").build()));

            assertEquals(1, issues.size());
            assertTrue(issues.get(0).message().startsWith("unreachable"));
        }
    }

    @Test
    @DisplayName("implies reasons about whenNone keys")
    void impliesWithNone() {
        PhaseRule narrow = enter("PLAN").whenAll("a").whenNone("b").build();
        PhaseRule broad = enter("EXECUTE").whenAll("a").build();

        assertTrue(RuleOverlapChecker.implies(narrow, broad));
        assertFalse(RuleOverlapChecker.implies(broad, narrow));
        assertTrue(RuleOverlapChecker.jointlySatisfiable(narrow, broad));
    }
}
