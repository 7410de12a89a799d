/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Serializable diagnostic form of a {@link Decision}. Absent sections are omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"allowed", "reason", "retry_after", "spending", "rule_id"})
public record DecisionReport(
        @JsonProperty("allowed") boolean allowed,
        @JsonProperty("reason") String reason,
        @JsonProperty("retry_after") Long retryAfter,
        @JsonProperty("spending") Spending spending,
        @JsonProperty("rule_id") String ruleId
) {

    @JsonPropertyOrder({"current", "limit", "remaining", "currency"})
    public record Spending(
            @JsonProperty("current") BigDecimal current,
            @JsonProperty("limit") BigDecimal limit,
            @JsonProperty("remaining") BigDecimal remaining,
            @JsonProperty("currency") String currency
    ) {
    }
}
