/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.ir;

import com.tollgate.policyengine.compiler.PolicyCompiler;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PlanBuilderTest {

    private static final String POLICY = """
            version: "2"
            policies:
              - type: rate_limit
                max_requests: 5
                window_seconds: 60
              - type: allowlist
                field: agent_id
                values: ["agent-*"]
              - type: denylist
                field: ip_address
                values: ["10.0.0.1"]
              - type: spending_cap
                max_amount: 0.0000005
                currency: SOL
                window_seconds: 86400
              - type: denylist
                field: agent_id
                values: [agent-evil]
            pricing:
              amount: 0.02
              currency: SOL
            """;

    private final PlanBuilder builder = new PlanBuilder();

    @Test
    void ordersEntriesByStageThenPolicyPosition() {
        EnforcementPlan plan = builder.build(new PolicyCompiler().compile(POLICY));

        assertThat(plan.entries())
                .extracting(StageEntry::stage, StageEntry::ruleIndex)
                .containsExactly(
                        tuple(Stage.DENY, 2),
                        tuple(Stage.DENY, 4),
                        tuple(Stage.ALLOW, 1),
                        tuple(Stage.RATE_LIMIT, 0),
                        tuple(Stage.SPENDING_CAP, 3));
        assertThat(plan.entriesFor(Stage.DENY)).hasSize(2);
        assertThat(plan.rules()).hasSize(5);
        assertThat(plan.version()).isEqualTo("2");
        assertThat(plan.pricing().currency()).isEqualTo("SOL");
    }

    @Test
    void amountScaleCoversEveryCap() {
        EnforcementPlan plan = builder.build(new PolicyCompiler().compile(POLICY));

        assertThat(plan.amountScale()).isEqualTo(7);
    }

    @Test
    void fingerprintDependsOnlyOnRules() {
        ValidatedPolicy first = new PolicyCompiler().compile(POLICY);
        ValidatedPolicy second = new PolicyCompiler().compile(POLICY.replace("amount: 0.02", "amount: 0.05"));
        ValidatedPolicy changed = new PolicyCompiler().compile(POLICY.replace("max_requests: 5", "max_requests: 6"));

        String fingerprint = builder.build(first).fingerprint();

        assertThat(fingerprint).hasSize(64).matches("[0-9a-f]+");
        assertThat(builder.build(second).fingerprint()).isEqualTo(fingerprint);
        assertThat(builder.build(changed).fingerprint()).isNotEqualTo(fingerprint);
        assertThat(PlanBuilder.sha256(builder.build(first).rulesJson())).isEqualTo(fingerprint);
    }
}
