/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tollgate.policyengine.api.model.Decision;
import com.tollgate.policyengine.api.model.EvaluationRequest;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One enforcement decision as written to the audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditRecord(
        @JsonProperty("subject_key") String subjectKey,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("decision") String decision,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("timestamp") Instant timestamp
) {

    public static AuditRecord of(EvaluationRequest request, Decision decision) {
        return new AuditRecord(
                request.subjectKey(),
                decision.ruleId(),
                decision.outcome(),
                request.estimatedCost(),
                request.timestamp());
    }
}
