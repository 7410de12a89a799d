/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.ir;

import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.SubjectField;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalJsonTest {

    @Test
    void writesRulesWithPolicyFileKeys() {
        String json = CanonicalJson.rules(List.of(
                new Rule.RateLimit("burst", 10, 60),
                new Rule.SpendingCap("budget", new BigDecimal("1000.50"), "USDC", 3600)));

        assertThat(json).isEqualTo("[{\"type\":\"rate_limit\",\"id\":\"burst\",\"max_requests\":10,\"window_seconds\":60},"
                + "{\"type\":\"spending_cap\",\"id\":\"budget\",\"max_amount\":1000.5,\"currency\":\"USDC\","
                + "\"window_seconds\":3600}]");
    }

    @Test
    void neverEmitsCommentTerminator() {
        String json = CanonicalJson.rules(List.of(
                new Rule.Denylist("odd*/id", SubjectField.AGENT_ID, List.of("prefix*"))));

        assertThat(json).doesNotContain("*/").doesNotContain("*");
    }

    @Test
    void writesPricingAmountAsString() {
        assertThat(CanonicalJson.pricing(Policy.Pricing.DEFAULT))
                .isEqualTo("{\"amount\":\"0.01\",\"currency\":\"USDC\",\"memo_prefix\":null}");
    }

    @Test
    void quotesStrings() {
        assertThat(CanonicalJson.string("say \"hi\"\n")).isEqualTo("\"say \\\"hi\\\"\\n\"");
    }
}
