package com.lodestar.core.validation;

import com.lodestar.core.phase.Phase;
import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.phase.PhaseSet;
import com.lodestar.core.policy.ControlPolicy;
import com.lodestar.core.policy.TransitionPolicy;
import com.lodestar.core.procedure.Action;
import com.lodestar.core.procedure.ProcedureTemplate;
import com.lodestar.core.validation.ValidationIssue.Category;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs every construction-time check over the parts of an agent spec and
 * returns all issues found. Callers decide what to do with errors; the
 * agent spec builder throws {@link SpecValidationException} on any.
 */
public class SpecValidator {

    private final RuleOverlapChecker overlapChecker;
    private final FactScopeValidator scopeValidator;

    public SpecValidator() {
        this(new RuleOverlapChecker(), new FactScopeValidator());
    }

    public SpecValidator(RuleOverlapChecker overlapChecker, FactScopeValidator scopeValidator) {
        this.overlapChecker = overlapChecker;
        this.scopeValidator = scopeValidator;
    }

    public List<ValidationIssue> validate(String name,
                                          String version,
                                          PhaseSet phases,
                                          ControlPolicy controlPolicy,
                                          TransitionPolicy transitionPolicy,
                                          Map<Phase, ProcedureTemplate> procedures) {
        var issues = new ArrayList<ValidationIssue>();
        checkNames(name, version, issues);
        if (phases == null || controlPolicy == null || transitionPolicy == null) {
            if (phases == null) {
                issues.add(ValidationIssue.error(Category.PHASE_REFERENCE, "phases", "a phase set is required"));
            }
            if (controlPolicy == null) {
                issues.add(ValidationIssue.error(Category.CONTROL_POLICY, "control policy", "a control policy is required"));
            }
            if (transitionPolicy == null) {
                issues.add(ValidationIssue.error(Category.PHASE_REFERENCE, "transition policy",
                        "a transition policy with a default phase is required"));
            }
            return issues;
        }

        checkPhaseReferences(phases, controlPolicy, transitionPolicy, procedures, issues);
        checkProcedures(phases, procedures, issues);
        checkControlPolicy(controlPolicy, issues);
        issues.addAll(overlapChecker.check(transitionPolicy.rules()));
        issues.addAll(scopeValidator.check(transitionPolicy.rules(), controlPolicy, procedures));
        return issues;
    }

    private static void checkNames(String name, String version, List<ValidationIssue> issues) {
        if (name == null || name.isBlank()) {
            issues.add(ValidationIssue.error(Category.NAME, "name", "agent name must not be blank"));
        }
        if (version == null || version.isBlank()) {
            issues.add(ValidationIssue.error(Category.NAME, "version", "agent version must not be blank"));
        }
    }

    private static void checkPhaseReferences(PhaseSet phases,
                                             ControlPolicy controlPolicy,
                                             TransitionPolicy transitionPolicy,
                                             Map<Phase, ProcedureTemplate> procedures,
                                             List<ValidationIssue> issues) {
        requireMember(phases, transitionPolicy.defaultPhase(), "default phase", issues);
        List<PhaseRule> rules = transitionPolicy.rules();
        for (int i = 0; i < rules.size(); i++) {
            requireMember(phases, rules.get(i).enter(), RuleOverlapChecker.subject(i, rules.get(i)), issues);
        }
        controlPolicy.contextPhaseOptional()
                .ifPresent(phase -> requireMember(phases, phase, "control policy context phase", issues));
        for (Phase phase : procedures.keySet()) {
            requireMember(phases, phase, "procedure '" + procedures.get(phase).name() + "'", issues);
        }
    }

    private static void requireMember(PhaseSet phases, Phase phase, String subject, List<ValidationIssue> issues) {
        if (!phases.contains(phase)) {
            issues.add(ValidationIssue.error(Category.PHASE_REFERENCE, subject,
                    "references phase " + phase + " which is not a member of " + phases));
        }
    }

    private static void checkProcedures(PhaseSet phases,
                                        Map<Phase, ProcedureTemplate> procedures,
                                        List<ValidationIssue> issues) {
        for (Phase phase : phases) {
            if (!procedures.containsKey(phase)) {
                issues.add(ValidationIssue.warning(Category.PROCEDURE, "phase " + phase.name(),
                        "has no procedure; reaching it without a control preemption runs nothing"));
            }
        }
        procedures.forEach((phase, procedure) -> {
            Set<String> names = new HashSet<>();
            for (Action action : procedure.actions()) {
                String subject = "procedure '" + procedure.name() + "'";
                if (action.emits() == null) {
                    issues.add(ValidationIssue.error(Category.PROCEDURE, subject,
                            "action '" + action.name() + "' declares no emission spec"));
                }
                if (!names.add(action.name())) {
                    issues.add(ValidationIssue.error(Category.PROCEDURE, subject,
                            "action name '" + action.name() + "' appears twice; history is recorded per action name"));
                }
            }
        });
    }

    private static void checkControlPolicy(ControlPolicy controlPolicy, List<ValidationIssue> issues) {
        var overlap = new TreeSet<String>(controlPolicy.completionKeys());
        overlap.retainAll(controlPolicy.failureKeys());
        if (!overlap.isEmpty()) {
            issues.add(ValidationIssue.error(Category.CONTROL_POLICY, "control policy",
                    "keys " + overlap + " are both completion and failure keys"));
        }
    }
}
