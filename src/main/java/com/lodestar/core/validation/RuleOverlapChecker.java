package com.lodestar.core.validation;

import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.validation.ValidationIssue.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects transition rules whose outcome would depend on declaration order
 * in a way the author did not intend.
 * <p>
 * For every pair of rules {@code (earlier, later)} entering different phases:
 * <ul>
 *   <li>if every key set matching {@code later} also matches {@code earlier},
 *       the later rule is unreachable (shadowed);</li>
 *   <li>otherwise, if some key set matches both, the pair is accepted only
 *       when {@code earlier} strictly refines {@code later}, i.e. every key set
 *       matching {@code earlier} also matches {@code later} (a specific rule
 *       placed before its fallback).</li>
 * </ul>
 * A rule that can never match is reported as well.
 */
public class RuleOverlapChecker {

    public List<ValidationIssue> check(List<PhaseRule> rules) {
        var issues = new ArrayList<ValidationIssue>();
        var satisfiable = new boolean[rules.size()];
        for (int i = 0; i < rules.size(); i++) {
            PhaseRule rule = rules.get(i);
            satisfiable[i] = isSatisfiable(rule);
            if (!satisfiable[i]) {
                issues.add(ValidationIssue.error(Category.RULE_OVERLAP, subject(i, rule),
                        "rule can never match: its conditions contradict each other"));
            }
        }
        for (int j = 1; j < rules.size(); j++) {
            for (int i = 0; i < j; i++) {
                if (!satisfiable[i] || !satisfiable[j]) {
                    continue;
                }
                PhaseRule earlier = rules.get(i);
                PhaseRule later = rules.get(j);
                if (earlier.enter().equals(later.enter())) {
                    continue;
                }
                if (implies(later, earlier)) {
                    issues.add(ValidationIssue.error(Category.RULE_OVERLAP, subject(j, later),
                            "unreachable: every state it matches is already matched by " + subject(i, earlier)));
                } else if (jointlySatisfiable(earlier, later) && !implies(earlier, later)) {
                    issues.add(ValidationIssue.error(Category.RULE_OVERLAP, subject(j, later),
                            "ambiguous overlap with " + subject(i, earlier)
                                    + ": both can match the same state and neither is a fallback of the other"));
                }
            }
        }
        return issues;
    }

    static boolean isSatisfiable(PhaseRule rule) {
        if (!Collections.disjoint(rule.whenAll(), rule.whenNone())) {
            return false;
        }
        return rule.whenAny().isEmpty() || !minus(rule.whenAny(), rule.whenNone()).isEmpty();
    }

    /**
     * True when every key set matching {@code a} also matches {@code b}. Assumes {@code a} is satisfiable.
     */
    static boolean implies(PhaseRule a, PhaseRule b) {
        // any key b forbids must be forbidden by a, otherwise it can be added to an a-match
        if (!a.whenNone().containsAll(b.whenNone())) {
            return false;
        }
        Set<String> anyCandidates = minus(a.whenAny(), a.whenNone());
        var forced = new HashSet<String>(a.whenAll());
        if (anyCandidates.size() == 1) {
            forced.addAll(anyCandidates);
        }
        if (!forced.containsAll(b.whenAll())) {
            return false;
        }
        if (b.whenAny().isEmpty() || !Collections.disjoint(a.whenAll(), b.whenAny())) {
            return true;
        }
        return !anyCandidates.isEmpty() && b.whenAny().containsAll(anyCandidates);
    }

    static boolean jointlySatisfiable(PhaseRule a, PhaseRule b) {
        var all = new HashSet<String>(a.whenAll());
        all.addAll(b.whenAll());
        var none = new HashSet<String>(a.whenNone());
        none.addAll(b.whenNone());
        if (!Collections.disjoint(all, none)) {
            return false;
        }
        return (a.whenAny().isEmpty() || !minus(a.whenAny(), none).isEmpty())
                && (b.whenAny().isEmpty() || !minus(b.whenAny(), none).isEmpty());
    }

    private static Set<String> minus(Set<String> from, Set<String> remove) {
        var out = new HashSet<String>(from);
        out.removeAll(remove);
        return out;
    }

    static String subject(int index, PhaseRule rule) {
        return "rules[" + index + "] (enter " + rule.enter().name() + " when " + rule.describeCondition() + ")";
    }
}
