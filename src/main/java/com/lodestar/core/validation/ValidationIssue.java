package com.lodestar.core.validation;

import java.util.Objects;

/**
 * One problem found while validating an agent spec.
 *
 * @param severity errors abort construction, warnings are logged and kept on the spec
 * @param category which check produced the issue
 * @param subject  what the issue is about, e.g. {@code rules[1]} or {@code action 'Plan'}
 * @param message  human-readable explanation
 */
public record ValidationIssue(Severity severity, Category category, String subject, String message) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public enum Category {
        NAME,
        PHASE_REFERENCE,
        PROCEDURE,
        RULE_OVERLAP,
        FACT_SCOPE,
        CONTROL_POLICY
    }

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationIssue error(Category category, String subject, String message) {
        return new ValidationIssue(Severity.ERROR, category, subject, message);
    }

    public static ValidationIssue warning(Category category, String subject, String message) {
        return new ValidationIssue(Severity.WARNING, category, subject, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + category + " " + subject + ": " + message;
    }
}
