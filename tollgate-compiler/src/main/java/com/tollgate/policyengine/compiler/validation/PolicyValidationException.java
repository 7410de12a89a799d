/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a policy has at least one validation error. Carries all of them, not just the first.
 */
public class PolicyValidationException extends RuntimeException {

    private final List<ValidationIssue> errors;

    public PolicyValidationException(List<ValidationIssue> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationIssue> getErrors() {
        return errors;
    }

    private static String buildMessage(List<ValidationIssue> errors) {
        return "Policy validation failed with " + errors.size() + " error(s): "
                + errors.stream().map(ValidationIssue::message).collect(Collectors.joining("; "));
    }
}
