/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.exceptions;

/**
 * Signals a broken internal invariant, such as corrupted runtime state or an invalid policy
 * reaching code generation. Never a business outcome.
 */
public class InternalEngineException extends RuntimeException {

    public InternalEngineException(String message) {
        super(message);
    }

    public InternalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
