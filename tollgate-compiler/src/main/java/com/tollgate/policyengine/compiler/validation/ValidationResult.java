/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.validation;

import java.util.List;
import java.util.Optional;

/**
 * Everything the validator found, plus the validated policy when no error was found.
 */
public final class ValidationResult {

    private final List<ValidationIssue> issues;
    private final ValidatedPolicy policy;

    ValidationResult(List<ValidationIssue> issues, ValidatedPolicy policy) {
        this.issues = List.copyOf(issues);
        this.policy = policy;
    }

    public boolean isValid() {
        return policy != null;
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).toList();
    }

    public Optional<ValidatedPolicy> policy() {
        return Optional.ofNullable(policy);
    }

    /**
     * @throws PolicyValidationException carrying every error when the policy is invalid
     */
    public ValidatedPolicy orElseThrow() {
        if (policy == null) {
            throw new PolicyValidationException(errors());
        }
        return policy;
    }
}
