package com.lodestar.core.validation;

import com.lodestar.core.fact.Scope;
import com.lodestar.core.phase.Phase;
import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.phase.PhaseSet;
import com.lodestar.core.policy.ControlPolicy;
import com.lodestar.core.policy.TransitionPolicy;
import com.lodestar.core.procedure.FakeAction;
import com.lodestar.core.procedure.ProcedureTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpecValidatorTest {

    private final PhaseSet phases = PhaseSet.create("START", "DONE");
    private final Phase start = phases.phase("START");
    private final Phase done = phases.phase("DONE");
    private final SpecValidator validator = new SpecValidator();

    private final TransitionPolicy transitions = TransitionPolicy.of(start,
            PhaseRule.enter(done).whenAll("said_hello").build());

    private Map<Phase, ProcedureTemplate> helloProcedures() {
        var procedures = new LinkedHashMap<Phase, ProcedureTemplate>();
        procedures.put(start, ProcedureTemplate.of("greet", FakeAction.flag("SayHello", "said_hello", Scope.SESSION)));
        procedures.put(done, ProcedureTemplate.empty("done"));
        return procedures;
    }

    private static List<ValidationIssue> errors(List<ValidationIssue> issues) {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    @Test
    @DisplayName("a well-formed spec has no issues")
    void valid() {
        ControlPolicy policy = ControlPolicy.builder().completionKeys("said_hello").build();

        assertTrue(validator.validate("hello", "1.0", phases, policy, transitions, helloProcedures()).isEmpty());
    }

    @Test
    @DisplayName("reports missing parts all at once")
    void missingParts() {
        List<ValidationIssue> issues = validator.validate(" ", "", null, null, null, Map.of());

        assertEquals(5, errors(issues).size());
    }

    @Test
    @DisplayName("rejects phases from another set")
    void foreignPhase() {
        Phase foreign = PhaseSet.named("Other", "START").phase("START");
        TransitionPolicy policy = TransitionPolicy.of(foreign);

        List<ValidationIssue> issues = validator.validate("hello", "1.0", phases, ControlPolicy.none(), policy, helloProcedures());

        assertEquals(1, errors(issues).size());
        assertEquals(ValidationIssue.Category.PHASE_REFERENCE, errors(issues).get(0).category());
        assertEquals("default phase", errors(issues).get(0).subject());
    }

    @Test
    @DisplayName("rejects a context phase outside the set")
    void foreignContextPhase() {
        ControlPolicy policy = ControlPolicy.builder()
                .contextPhase(PhaseSet.create("GATHER").phase("GATHER"))
                .build();

        List<ValidationIssue> issues = validator.validate("hello", "1.0", phases, policy, transitions, helloProcedures());

        assertTrue(errors(issues).stream().anyMatch(i -> i.subject().equals("control policy context phase")));
    }

    @Test
    @DisplayName("warns about phases without a procedure")
    void phaseWithoutProcedure() {
        var procedures = helloProcedures();
        procedures.remove(done);

        List<ValidationIssue> issues = validator.validate("hello", "1.0", phases, ControlPolicy.none(), transitions, procedures);

        assertTrue(errors(issues).isEmpty());
        assertTrue(issues.stream().anyMatch(i -> i.subject().equals("phase DONE")));
    }

    @Test
    @DisplayName("rejects duplicate action names and null emission specs")
    void procedureProblems() {
        var procedures = new LinkedHashMap<Phase, ProcedureTemplate>();
        procedures.put(start, ProcedureTemplate.of("greet",
                FakeAction.flag("SayHello", "said_hello", Scope.SESSION),
                FakeAction.noop("SayHello"),
                new FakeAction("Broken", null, (facts, context) -> null)));
        procedures.put(done, ProcedureTemplate.empty("done"));

        List<ValidationIssue> issues = validator.validate("hello", "1.0", phases, ControlPolicy.none(), transitions, procedures);

        assertEquals(2, errors(issues).size());
        assertTrue(errors(issues).stream().allMatch(i -> i.category() == ValidationIssue.Category.PROCEDURE));
    }

    @Test
    @DisplayName("rejects keys that are both completion and failure keys")
    void completionFailureOverlap() {
        ControlPolicy policy = ControlPolicy.builder()
                .completionKeys("said_hello")
                .failureKeys("said_hello")
                .build();

        List<ValidationIssue> issues = validator.validate("hello", "1.0", phases, policy, transitions, helloProcedures());

        assertTrue(errors(issues).stream().anyMatch(i -> i.category() == ValidationIssue.Category.CONTROL_POLICY));
    }

    @Test
    @DisplayName("exception message lists every issue")
    void exceptionMessage() {
        var issues = List.of(
                ValidationIssue.error(ValidationIssue.Category.NAME, "name", "agent name must not be blank"),
                ValidationIssue.warning(ValidationIssue.Category.PROCEDURE, "phase DONE", "has no procedure"));

        var ex = new SpecValidationException("hello", issues);

        assertTrue(ex.getMessage().startsWith("Agent spec 'hello' is invalid (1 error(s))"));
        assertTrue(ex.getMessage().contains("[WARNING] PROCEDURE phase DONE: has no procedure"));
        assertEquals(1, ex.errors().size());
    }
}
