/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler;

import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for turning a policy file into a policy that is ready to enforce.
 */
public interface IPolicyCompiler {

    /**
     * Parses and validates the policy at {@code policyPath}.
     *
     * @throws IOException if the file cannot be read
     * @throws com.tollgate.policyengine.api.exceptions.PolicyParseException if the text is malformed
     * @throws com.tollgate.policyengine.compiler.validation.PolicyValidationException if validation finds errors
     */
    ValidatedPolicy compile(Path policyPath) throws IOException;

    /**
     * Sets the tracer for observability.
     */
    default void setTracer(Tracer tracer) {
    }
}
