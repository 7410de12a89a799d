/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.validation;

public enum Severity {
    /** Blocks the policy from being used. */
    ERROR,
    /** Policy is usable but probably not what the author meant. */
    WARNING
}
