/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of evaluating one request against a policy.
 *
 * <p>A decision is a value, never an error: denials, rate limiting and exhausted budgets are
 * ordinary results. {@link #toReport()} renders the diagnostic form exposed to callers.
 */
public sealed interface Decision
        permits Decision.Allow, Decision.Deny, Decision.RateLimited, Decision.SpendingCapExceeded {

    String REASON_DENYLISTED = "denylisted";
    String REASON_NOT_ALLOWLISTED = "not in allowlist";
    String REASON_RATE_LIMITED = "rate limit exceeded";
    String REASON_SPENDING_CAP = "spending cap exceeded";

    boolean isAllowed();

    /**
     * Short machine-readable outcome, used as a metric tag and in audit records.
     */
    String outcome();

    /**
     * Id of the rule that produced a non-allow decision, or {@code null} for {@link Allow}.
     */
    String ruleId();

    DecisionReport toReport();

    static Allow allow() {
        return Allow.UNRESTRICTED;
    }

    /**
     * @param authoritativeMatches for each allowlisted field present on the request, the most
     *                             specific matching allowlist entry
     */
    record Allow(Map<SubjectField, String> authoritativeMatches) implements Decision {
        static final Allow UNRESTRICTED = new Allow(Map.of());

        public Allow {
            authoritativeMatches = authoritativeMatches.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new EnumMap<>(authoritativeMatches));
        }

        @Override
        public boolean isAllowed() {
            return true;
        }

        @Override
        public String outcome() {
            return "allow";
        }

        @Override
        public String ruleId() {
            return null;
        }

        @Override
        public DecisionReport toReport() {
            return new DecisionReport(true, "allowed", null, null, null);
        }
    }

    record Deny(String reason, String ruleId) implements Decision {
        public Deny {
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(ruleId, "ruleId must not be null");
        }

        @Override
        public boolean isAllowed() {
            return false;
        }

        @Override
        public String outcome() {
            return "deny";
        }

        @Override
        public DecisionReport toReport() {
            return new DecisionReport(false, reason, null, null, ruleId);
        }
    }

    record RateLimited(long retryAfterSeconds, String ruleId) implements Decision {
        public RateLimited {
            if (retryAfterSeconds < 1) {
                throw new IllegalArgumentException("retryAfterSeconds must be at least 1: " + retryAfterSeconds);
            }
            Objects.requireNonNull(ruleId, "ruleId must not be null");
        }

        @Override
        public boolean isAllowed() {
            return false;
        }

        @Override
        public String outcome() {
            return "rate_limited";
        }

        @Override
        public DecisionReport toReport() {
            return new DecisionReport(false, REASON_RATE_LIMITED, retryAfterSeconds, null, ruleId);
        }
    }

    record SpendingCapExceeded(BigDecimal current,
                               BigDecimal limit,
                               BigDecimal remaining,
                               String currency,
                               String ruleId) implements Decision {
        public SpendingCapExceeded {
            Objects.requireNonNull(current, "current must not be null");
            Objects.requireNonNull(limit, "limit must not be null");
            Objects.requireNonNull(remaining, "remaining must not be null");
            Objects.requireNonNull(currency, "currency must not be null");
            Objects.requireNonNull(ruleId, "ruleId must not be null");
        }

        @Override
        public boolean isAllowed() {
            return false;
        }

        @Override
        public String outcome() {
            return "spending_cap_exceeded";
        }

        @Override
        public DecisionReport toReport() {
            return new DecisionReport(false, REASON_SPENDING_CAP, null,
                    new DecisionReport.Spending(current, limit, remaining, currency), ruleId);
        }
    }
}
