package com.lodestar.core.validation;

import com.lodestar.core.emission.Emission;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.phase.Phase;
import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.policy.ControlPolicy;
import com.lodestar.core.procedure.Action;
import com.lodestar.core.procedure.ProcedureTemplate;
import com.lodestar.core.validation.ValidationIssue.Category;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-references every key the transition rules and the control policy
 * depend on with the emissions declared by the procedures' actions.
 * <p>
 * Rules and control checks only ever see durable facts. A key declared with
 * iteration scope would vanish before it could be seen, so the spec is
 * rejected. A key no action declares is only a warning, since the runtime
 * may supply it externally (bootstrap seeds, user input).
 */
public class FactScopeValidator {

    private record Declaration(String action, Phase phase, Emission emission) {}

    public List<ValidationIssue> check(List<PhaseRule> rules,
                                       ControlPolicy controlPolicy,
                                       Map<Phase, ProcedureTemplate> procedures) {
        Map<String, List<Declaration>> declarations = declarations(procedures);

        // key -> referencers, rules first, then control sets
        var references = new LinkedHashMap<String, List<String>>();
        for (int i = 0; i < rules.size(); i++) {
            PhaseRule rule = rules.get(i);
            String subject = RuleOverlapChecker.subject(i, rule);
            rule.referencedKeys().forEach(key -> references.computeIfAbsent(key, k -> new ArrayList<>()).add(subject));
        }
        addControlReferences(references, "control policy required state keys", controlPolicy.requiredStateKeys());
        addControlReferences(references, "control policy user-required keys", controlPolicy.userRequiredKeys());
        addControlReferences(references, "control policy completion keys", controlPolicy.completionKeys());
        addControlReferences(references, "control policy failure keys", controlPolicy.failureKeys());

        var issues = new ArrayList<ValidationIssue>();
        references.forEach((key, referencers) -> {
            List<Declaration> declared = declarations.getOrDefault(key, List.of());
            if (declared.isEmpty()) {
                issues.add(ValidationIssue.warning(Category.FACT_SCOPE, "key '" + key + "'",
                        "referenced by " + referencers.get(0)
                                + " but emitted by no action; it must be supplied externally"));
                return;
            }
            for (Declaration d : declared) {
                if (d.emission().scope() == Scope.ITERATION) {
                    for (String referencer : referencers) {
                        issues.add(ValidationIssue.error(Category.FACT_SCOPE, "action '" + d.action() + "'",
                                "emits '" + key + "' with iteration scope in phase " + d.phase().name()
                                        + ", but " + referencer + " depends on it;"
                                        + " iteration facts never reach the durable state. Use session or persistent scope"));
                    }
                }
            }
        });
        return issues;
    }

    private static void addControlReferences(Map<String, List<String>> references, String subject, Set<String> keys) {
        keys.forEach(key -> references.computeIfAbsent(key, k -> new ArrayList<>()).add(subject));
    }

    private static Map<String, List<Declaration>> declarations(Map<Phase, ProcedureTemplate> procedures) {
        var out = new LinkedHashMap<String, List<Declaration>>();
        var seen = new HashSet<Action>();
        procedures.forEach((phase, procedure) -> {
            for (Action action : procedure.actions()) {
                if (action.emits() == null || !seen.add(action)) {
                    continue;
                }
                action.emits().toMap().forEach((key, emission) -> out
                        .computeIfAbsent(key, k -> new ArrayList<>())
                        .add(new Declaration(action.name(), phase, emission)));
            }
        });
        return out;
    }
}
