/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationRequestTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    @DisplayName("Subject key follows agent, wallet, ip order")
    void subjectKeyResolutionOrder() {
        EvaluationRequest all = EvaluationRequest.builder()
                .agentId("a1").walletAddress("0xabc").ipAddress("10.0.0.1").timestamp(NOW).build();
        EvaluationRequest walletAndIp = EvaluationRequest.builder()
                .walletAddress("0xabc").ipAddress("10.0.0.1").timestamp(NOW).build();
        EvaluationRequest ipOnly = EvaluationRequest.builder().ipAddress("10.0.0.1").timestamp(NOW).build();

        assertThat(all.subjectKey()).isEqualTo("agent_id=a1");
        assertThat(walletAndIp.subjectKey()).isEqualTo("wallet_address=0xabc");
        assertThat(ipOnly.subjectKey()).isEqualTo("ip_address=10.0.0.1");
    }

    @Test
    void requestWithoutIdentityIsAnonymous() {
        EvaluationRequest request = EvaluationRequest.builder().agentId("  ").timestamp(NOW).build();

        assertThat(request.agentId()).isNull();
        assertThat(request.subjectKey()).isEqualTo(EvaluationRequest.ANONYMOUS_SUBJECT);
        assertThat(request.attributes()).isEmpty();
    }

    @Test
    void defaultsCostToZeroAndTimestampToClock() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        EvaluationRequest request = EvaluationRequest.builder().agentId("a").clock(clock).build();

        assertThat(request.estimatedCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(request.timestamp()).isEqualTo(NOW);
    }

    @Test
    void rejectsNegativeCost() {
        assertThatThrownBy(() -> EvaluationRequest.builder().estimatedCost("-0.01").timestamp(NOW).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }
}
