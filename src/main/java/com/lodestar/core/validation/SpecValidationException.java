package com.lodestar.core.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when an agent spec fails validation. Carries every issue found, not just the first.
 */
public class SpecValidationException extends RuntimeException {

    private final List<ValidationIssue> issues;

    public SpecValidationException(String message) {
        super(message);
        this.issues = List.of();
    }

    public SpecValidationException(String message, Throwable cause) {
        super(message, cause);
        this.issues = List.of();
    }

    public SpecValidationException(String specName, List<ValidationIssue> issues) {
        super(format(specName, issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    private static String format(String specName, List<ValidationIssue> issues) {
        long errors = issues.stream().filter(ValidationIssue::isError).count();
        return "Agent spec '" + specName + "' is invalid (" + errors + " error(s)):\n"
                + issues.stream().map(i -> "  - " + i).collect(Collectors.joining("\n"));
    }
}
