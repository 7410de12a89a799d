/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.exceptions;

import java.util.List;

/**
 * Thrown when code generation is requested for a framework no renderer is registered for.
 */
public class UnsupportedFrameworkException extends RuntimeException {

    private final String framework;
    private final List<String> supported;

    public UnsupportedFrameworkException(String framework, List<String> supported) {
        super("Unsupported framework '" + framework + "'. Supported: " + String.join(", ", supported));
        this.framework = framework;
        this.supported = List.copyOf(supported);
    }

    public String getFramework() {
        return framework;
    }

    public List<String> getSupported() {
        return supported;
    }
}
