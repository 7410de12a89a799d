/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.enforcement;

import com.tollgate.policyengine.api.audit.AuditRecord;
import com.tollgate.policyengine.api.audit.AuditSink;
import com.tollgate.policyengine.api.audit.NoopAuditSink;
import com.tollgate.policyengine.api.model.Decision;
import com.tollgate.policyengine.api.model.EvaluationRequest;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.runtime.evaluation.PolicyEvaluator;
import com.tollgate.policyengine.runtime.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Enforcement point for one protected surface: owns the state store and pairs every check
 * with the policy snapshot it was made against.
 *
 * <pre>{@code
 * PolicyManager manager = new PolicyManager(path, tracer, new PolicyCompiler());
 * PolicyEnforcer enforcer = new PolicyEnforcer(manager::getPolicy, new PolicyEvaluator(),
 *         new StateStore(), new Slf4jAuditSink());
 *
 * EnforcementTicket ticket = enforcer.check(request);
 * if (ticket.isAllowed()) {
 *     handle(request);
 *     ticket.commit();
 * }
 * }</pre>
 */
public final class PolicyEnforcer {
    private static final Logger logger = LoggerFactory.getLogger(PolicyEnforcer.class);

    private final Supplier<ValidatedPolicy> policySource;
    private final PolicyEvaluator evaluator;
    private final StateStore stateStore;
    private final AuditSink auditSink;

    public PolicyEnforcer(Supplier<ValidatedPolicy> policySource,
                          PolicyEvaluator evaluator,
                          StateStore stateStore,
                          AuditSink auditSink) {
        this.policySource = Objects.requireNonNull(policySource, "policySource must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink must not be null");
    }

    /**
     * Enforcer for a fixed policy with a fresh state store and no audit trail.
     */
    public static PolicyEnforcer forPolicy(ValidatedPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        return new PolicyEnforcer(() -> policy, new PolicyEvaluator(), new StateStore(), NoopAuditSink.INSTANCE);
    }

    public EnforcementTicket check(EvaluationRequest request) {
        ValidatedPolicy policy = Objects.requireNonNull(policySource.get(), "no active policy");
        Decision decision = evaluator.evaluate(policy, request, stateStore);
        audit(AuditRecord.of(request, decision));
        return new EnforcementTicket(this, policy, request, decision);
    }

    public StateStore stateStore() {
        return stateStore;
    }

    void commit(ValidatedPolicy policy, EvaluationRequest request) {
        evaluator.commit(policy, request, stateStore);
    }

    private void audit(AuditRecord record) {
        try {
            auditSink.append(record);
        } catch (RuntimeException e) {
            logger.warn("Audit sink failed for {}; decision {} stands", record.subjectKey(), record.decision(), e);
        }
    }
}
