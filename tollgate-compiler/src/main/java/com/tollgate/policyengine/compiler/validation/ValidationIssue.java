/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.validation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single validation finding.
 *
 * @param severity     whether the finding blocks the policy
 * @param code         stable identifier of the check that fired
 * @param message      human-readable description
 * @param ruleIndices  positions in {@code policies} the finding refers to, empty for document-level findings
 * @param suggestions  possible fixes, in order of preference
 */
public record ValidationIssue(Severity severity,
                              IssueCode code,
                              String message,
                              List<Integer> ruleIndices,
                              List<String> suggestions) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        ruleIndices = List.copyOf(ruleIndices);
        suggestions = List.copyOf(suggestions);
    }

    public static ValidationIssue error(IssueCode code, String message, List<Integer> ruleIndices,
                                        String... suggestions) {
        return new ValidationIssue(Severity.ERROR, code, message, ruleIndices, List.of(suggestions));
    }

    public static ValidationIssue warning(IssueCode code, String message, List<Integer> ruleIndices,
                                          String... suggestions) {
        return new ValidationIssue(Severity.WARNING, code, message, ruleIndices, List.of(suggestions));
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Multi-line rendering used by the command line.
     */
    public String format() {
        StringBuilder sb = new StringBuilder()
                .append(severity).append(" [").append(code).append("] ").append(message);
        if (!ruleIndices.isEmpty()) {
            sb.append(" (rules ")
                    .append(ruleIndices.stream().map(String::valueOf).collect(Collectors.joining(", ")))
                    .append(')');
        }
        for (String suggestion : suggestions) {
            sb.append(System.lineSeparator()).append("  suggestion: ").append(suggestion);
        }
        return sb.toString();
    }
}
