/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.state;

import java.util.Objects;

/**
 * Identifies one window: a rule applied to one subject.
 *
 * @param ruleId  id of the rate limit or spending cap rule
 * @param subject subject key, see {@link com.tollgate.policyengine.api.model.EvaluationRequest#subjectKey()}
 */
public record StateKey(String ruleId, String subject) {

    public StateKey {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
    }

    @Override
    public String toString() {
        return ruleId + "|" + subject;
    }
}
