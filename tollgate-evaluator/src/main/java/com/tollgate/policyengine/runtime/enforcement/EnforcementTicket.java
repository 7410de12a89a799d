/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.enforcement;

import com.tollgate.policyengine.api.model.Decision;
import com.tollgate.policyengine.api.model.EvaluationRequest;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outcome of one check, bound to the policy snapshot that produced it.
 *
 * <p>Committing records usage against that same snapshot even if the enforcer's policy was
 * reloaded in between. A ticket commits at most once.
 */
public final class EnforcementTicket {
    private static final Logger logger = LoggerFactory.getLogger(EnforcementTicket.class);

    private final PolicyEnforcer enforcer;
    private final ValidatedPolicy policy;
    private final EvaluationRequest request;
    private final Decision decision;
    private final AtomicBoolean committed = new AtomicBoolean();

    EnforcementTicket(PolicyEnforcer enforcer, ValidatedPolicy policy, EvaluationRequest request, Decision decision) {
        this.enforcer = enforcer;
        this.policy = policy;
        this.request = request;
        this.decision = decision;
    }

    public Decision decision() {
        return decision;
    }

    public boolean isAllowed() {
        return decision.isAllowed();
    }

    public ValidatedPolicy policy() {
        return policy;
    }

    public EvaluationRequest request() {
        return request;
    }

    public boolean isCommitted() {
        return committed.get();
    }

    /**
     * Records the request's usage.
     *
     * @return true if usage was recorded, false if this ticket was already committed
     * @throws IllegalStateException if the request was not allowed
     */
    public boolean commit() {
        if (!decision.isAllowed()) {
            throw new IllegalStateException("Cannot commit a " + decision.outcome() + " decision");
        }
        if (!committed.compareAndSet(false, true)) {
            logger.warn("Ignoring repeated commit for {}", request.subjectKey());
            return false;
        }
        enforcer.commit(policy, request);
        return true;
    }
}
