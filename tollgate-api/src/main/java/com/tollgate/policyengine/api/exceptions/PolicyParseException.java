/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.exceptions;

/**
 * Thrown when policy text cannot be turned into a policy model.
 *
 * <p>Parsing is fail-fast: the exception describes the first offending construct. This is a
 * {@link RuntimeException} so callers that load trusted, pre-checked policies are not forced
 * to handle it.
 */
public class PolicyParseException extends RuntimeException {

    /** Rule index used for problems outside the {@code policies} list. */
    public static final int DOCUMENT_LEVEL = -1;

    private final int ruleIndex;
    private final String field;
    private final String expectedType;

    public PolicyParseException(String message, int ruleIndex, String field, String expectedType) {
        super(message);
        this.ruleIndex = ruleIndex;
        this.field = field;
        this.expectedType = expectedType;
    }

    public PolicyParseException(String message, Throwable cause) {
        super(message, cause);
        this.ruleIndex = DOCUMENT_LEVEL;
        this.field = null;
        this.expectedType = null;
    }

    public int getRuleIndex() {
        return ruleIndex;
    }

    public boolean isDocumentLevel() {
        return ruleIndex == DOCUMENT_LEVEL;
    }

    public String getField() {
        return field;
    }

    public String getExpectedType() {
        return expectedType;
    }
}
