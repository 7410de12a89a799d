/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.ir;

import com.tollgate.policyengine.api.model.Rule;

/**
 * Evaluation stages in the order generated code runs them.
 */
public enum Stage {
    DENY,
    ALLOW,
    RATE_LIMIT,
    SPENDING_CAP;

    public static Stage of(Rule rule) {
        if (rule instanceof Rule.Denylist) {
            return DENY;
        }
        if (rule instanceof Rule.Allowlist) {
            return ALLOW;
        }
        if (rule instanceof Rule.RateLimit) {
            return RATE_LIMIT;
        }
        return SPENDING_CAP;
    }
}
