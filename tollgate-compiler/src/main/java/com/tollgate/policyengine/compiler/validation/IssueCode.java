/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.validation;

/**
 * Stable identifiers for validation findings.
 */
public enum IssueCode {
    EMPTY_POLICY,
    ALLOW_DENY_CONFLICT,
    SHADOWED_ALLOW_VALUE,
    WINDOW_OUT_OF_RANGE,
    INVALID_MAX_REQUESTS,
    INVALID_MAX_AMOUNT,
    INVALID_PATTERN,
    EMPTY_VALUES,
    BLANK_CURRENCY,
    DUPLICATE_RULE_ID,
    DUPLICATE_VALUE,
    MULTIPLE_RATE_LIMITS,
    MULTIPLE_SPENDING_CAPS,
    INVALID_PRICING,
    INVALID_AUDIT_FORMAT
}
