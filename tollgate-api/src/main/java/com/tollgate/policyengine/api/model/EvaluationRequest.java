/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Attributes of one incoming request.
 *
 * <p>All identity attributes are optional; blank values are treated as absent. The estimated
 * cost defaults to zero and must not be negative.
 */
public record EvaluationRequest(String agentId,
                                String walletAddress,
                                String ipAddress,
                                BigDecimal estimatedCost,
                                Instant timestamp) {

    public static final String ANONYMOUS_SUBJECT = "anonymous";

    public EvaluationRequest {
        agentId = blankToNull(agentId);
        walletAddress = blankToNull(walletAddress);
        ipAddress = blankToNull(ipAddress);
        estimatedCost = estimatedCost != null ? estimatedCost : BigDecimal.ZERO;
        if (estimatedCost.signum() < 0) {
            throw new IllegalArgumentException("estimatedCost must not be negative: " + estimatedCost);
        }
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public Optional<String> attribute(SubjectField field) {
        switch (field) {
            case AGENT_ID:
                return Optional.ofNullable(agentId);
            case WALLET_ADDRESS:
                return Optional.ofNullable(walletAddress);
            case IP_ADDRESS:
                return Optional.ofNullable(ipAddress);
            default:
                throw new IllegalArgumentException("Unknown field: " + field);
        }
    }

    public Map<SubjectField, String> attributes() {
        Map<SubjectField, String> present = new EnumMap<>(SubjectField.class);
        for (SubjectField field : SubjectField.values()) {
            attribute(field).ifPresent(v -> present.put(field, v));
        }
        return present;
    }

    /**
     * Identity that usage is accounted against: the first present attribute in
     * {@link SubjectField} order, rendered as {@code field=value}, or {@value #ANONYMOUS_SUBJECT}.
     */
    public String subjectKey() {
        for (SubjectField field : SubjectField.values()) {
            Optional<String> value = attribute(field);
            if (value.isPresent()) {
                return field.key() + "=" + value.get();
            }
        }
        return ANONYMOUS_SUBJECT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String agentId;
        private String walletAddress;
        private String ipAddress;
        private BigDecimal estimatedCost = BigDecimal.ZERO;
        private Instant timestamp;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder walletAddress(String walletAddress) {
            this.walletAddress = walletAddress;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder estimatedCost(BigDecimal estimatedCost) {
            this.estimatedCost = estimatedCost;
            return this;
        }

        public Builder estimatedCost(String estimatedCost) {
            return estimatedCost(new BigDecimal(estimatedCost));
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Clock used to stamp the request when no explicit timestamp is set.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public EvaluationRequest build() {
            Instant ts = timestamp != null ? timestamp : clock.instant();
            return new EvaluationRequest(agentId, walletAddress, ipAddress, estimatedCost, ts);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
