package com.lodestar.core.validation;

import com.lodestar.core.fact.Scope;
import com.lodestar.core.phase.Phase;
import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.phase.PhaseSet;
import com.lodestar.core.policy.ControlPolicy;
import com.lodestar.core.procedure.FakeAction;
import com.lodestar.core.procedure.ProcedureTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactScopeValidatorTest {

    private final PhaseSet phases = PhaseSet.create("START", "DONE");
    private final Phase start = phases.phase("START");
    private final Phase done = phases.phase("DONE");
    private final FactScopeValidator validator = new FactScopeValidator();

    private final List<PhaseRule> rules = List.of(PhaseRule.enter(done).whenAll("said_hello").build());

    @Test
    @DisplayName("rejects a rule key that is only ever emitted with iteration scope")
    void iterationScopedRuleKey() {
        var procedures = Map.of(start, ProcedureTemplate.of("greet",
                FakeAction.flag("SayHello", "said_hello", Scope.ITERATION)));

        List<ValidationIssue> issues = validator.check(rules, ControlPolicy.none(), procedures);

        assertEquals(1, issues.size());
        ValidationIssue issue = issues.get(0);
        assertTrue(issue.isError());
        assertEquals("action 'SayHello'", issue.subject());
        assertTrue(issue.message().contains("'said_hello' with iteration scope in phase START"));
        assertTrue(issue.message().contains("rules[0] (enter DONE when said_hello)"));
    }

    @Test
    @DisplayName("accepts the same key once it is session-scoped")
    void sessionScopedRuleKey() {
        var procedures = Map.of(start, ProcedureTemplate.of("greet",
                FakeAction.flag("SayHello", "said_hello", Scope.SESSION)));

        assertTrue(validator.check(rules, ControlPolicy.none(), procedures).isEmpty());
    }

    @Test
    @DisplayName("checks control policy keys too")
    void controlKeys() {
        var procedures = Map.of(start, ProcedureTemplate.of("check",
                FakeAction.flag("Check", "broken", Scope.ITERATION)));
        ControlPolicy policy = ControlPolicy.builder().failureKeys("broken").build();

        List<ValidationIssue> issues = validator.check(List.of(), policy, procedures);

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).message().contains("control policy failure keys"));
    }

    @Test
    @DisplayName("warns about keys no action emits")
    void externalKey() {
        ControlPolicy policy = ControlPolicy.builder().userRequiredKeys("approval").build();

        List<ValidationIssue> issues = validator.check(List.of(), policy, Map.of());

        assertEquals(1, issues.size());
        assertFalse(issues.get(0).isError());
        assertEquals("key 'approval'", issues.get(0).subject());
    }
}
