/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.enforcement;

import com.tollgate.policyengine.api.audit.AuditRecord;
import com.tollgate.policyengine.api.audit.AuditSink;
import com.tollgate.policyengine.api.model.Decision;
import com.tollgate.policyengine.api.model.EvaluationRequest;
import com.tollgate.policyengine.compiler.PolicyCompiler;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.infra.config.EngineConfig;
import com.tollgate.policyengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.tollgate.policyengine.runtime.evaluation.PolicyEvaluator;
import com.tollgate.policyengine.runtime.state.StateKey;
import com.tollgate.policyengine.runtime.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class PolicyEnforcerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private static final ValidatedPolicy ONE_PER_MINUTE = new PolicyCompiler().compile("""
            policies:
              - type: denylist
                field: agent_id
                values: [bad]
              - type: rate_limit
                id: per-minute
                max_requests: 1
                window_seconds: 60
            """);

    private static final ValidatedPolicy BURST = new PolicyCompiler().compile("""
            policies:
              - type: rate_limit
                id: burst
                max_requests: 2
                window_seconds: 60
            """);

    @Mock
    private AuditSink failingSink;

    private final List<AuditRecord> audited = new CopyOnWriteArrayList<>();
    private final AtomicReference<ValidatedPolicy> active = new AtomicReference<>(ONE_PER_MINUTE);
    private PolicyEnforcer enforcer;

    @BeforeEach
    void setUp() {
        PolicyEvaluator evaluator = new PolicyEvaluator(EngineConfig.defaults(), new InMemoryMetricsRegistry());
        enforcer = new PolicyEnforcer(active::get, evaluator, new StateStore(), audited::add);
    }

    private static EvaluationRequest request(String agentId) {
        return EvaluationRequest.builder().agentId(agentId).timestamp(T0).build();
    }

    @Test
    void commitRecordsUsageOnce() {
        EnforcementTicket ticket = enforcer.check(request("a"));

        assertThat(ticket.isAllowed()).isTrue();
        assertThat(ticket.commit()).isTrue();
        assertThat(ticket.commit()).isFalse();
        assertThat(ticket.isCommitted()).isTrue();

        assertThat(enforcer.check(request("a")).decision()).isInstanceOf(Decision.RateLimited.class);
        assertThat(enforcer.stateStore().rateWindowFor(
                new StateKey("per-minute", "agent_id=a")).snapshot())
                .hasSize(1);
    }

    @Test
    void uncommittedTicketsLeaveNoUsage() {
        enforcer.check(request("a"));
        enforcer.check(request("a"));

        assertThat(enforcer.check(request("a")).isAllowed()).isTrue();
        assertThat(enforcer.stateStore().size()).isZero();
    }

    @Test
    void cannotCommitDeniedTicket() {
        EnforcementTicket ticket = enforcer.check(request("bad"));

        assertThat(ticket.decision()).isInstanceOf(Decision.Deny.class);
        assertThatThrownBy(ticket::commit)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("deny");
    }

    @Test
    @DisplayName("Should commit against the policy the ticket was checked with")
    void ticketPinsPolicySnapshot() {
        EnforcementTicket ticket = enforcer.check(request("a"));
        active.set(BURST);

        ticket.commit();

        assertThat(ticket.policy()).isSameAs(ONE_PER_MINUTE);
        assertThat(enforcer.stateStore().keys()).containsExactly(new StateKey("per-minute", "agent_id=a"));
    }

    @Test
    void everyCheckIsAudited() {
        enforcer.check(request("a"));
        enforcer.check(request("bad"));

        assertThat(audited).extracting(AuditRecord::subjectKey, AuditRecord::decision, AuditRecord::ruleId)
                .containsExactly(
                        tuple("agent_id=a", "allow", null),
                        tuple("agent_id=bad", "deny", "denylist-0"));
    }

    @Test
    void auditFailureDoesNotChangeDecision() {
        doThrow(new IllegalStateException("disk full")).when(failingSink).append(any());
        PolicyEnforcer withFailingSink = new PolicyEnforcer(() -> ONE_PER_MINUTE,
                new PolicyEvaluator(EngineConfig.defaults(), new InMemoryMetricsRegistry()),
                new StateStore(), failingSink);

        assertThat(withFailingSink.check(request("a")).isAllowed()).isTrue();
    }

    @Test
    void forPolicyUsesFreshStore() {
        PolicyEnforcer first = PolicyEnforcer.forPolicy(ONE_PER_MINUTE);
        PolicyEnforcer second = PolicyEnforcer.forPolicy(ONE_PER_MINUTE);

        first.check(request("a")).commit();

        assertThat(first.check(request("a")).isAllowed()).isFalse();
        assertThat(second.check(request("a")).isAllowed()).isTrue();
    }
}
