/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.evaluation;

import com.tollgate.policyengine.api.model.Decision;
import com.tollgate.policyengine.api.model.EvaluationRequest;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.SubjectField;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.infra.config.EngineConfig;
import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import com.tollgate.policyengine.infra.metrics.Timer;
import com.tollgate.policyengine.runtime.matching.ListMatch;
import com.tollgate.policyengine.runtime.matching.ListMatchCache;
import com.tollgate.policyengine.runtime.matching.SubjectListMatcher;
import com.tollgate.policyengine.runtime.state.StateKey;
import com.tollgate.policyengine.runtime.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decides requests against a validated policy and records usage after allowed requests.
 *
 * <h2>Precedence</h2>
 * <p>Stages run in a fixed order and the first non-allow outcome wins:
 * <ol>
 *   <li>denylists, over every present attribute</li>
 *   <li>allowlists, for every present attribute whose field has one</li>
 *   <li>rate limits, in policy order</li>
 *   <li>spending caps, in policy order</li>
 * </ol>
 *
 * <h2>State</h2>
 * <p>{@link #evaluate} only reads the {@link StateStore}. Usage is recorded by {@link #commit},
 * which callers invoke once the protected operation has succeeded. Check and commit are separate
 * steps, so two concurrent requests for the same subject may both be allowed against the same
 * window before either commits.
 *
 * <p>Thread-safe; one instance can serve any number of policies and stores.
 */
public final class PolicyEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(PolicyEvaluator.class);

    static final String DECISIONS_METRIC = "tollgate_decisions_total";
    static final String EVALUATION_METRIC = "tollgate_evaluation";
    static final String COMMITS_METRIC = "tollgate_commits_total";
    static final String STATE_ENTRIES_METRIC = "tollgate_state_entries";

    private final ListMatchCache matchCache;
    private final MetricsRegistry metrics;
    private final Timer evaluationTimer;

    public PolicyEvaluator() {
        this(EngineConfig.load(), MetricsRegistry.getInstance());
    }

    public PolicyEvaluator(EngineConfig config, MetricsRegistry metrics) {
        this.matchCache = new ListMatchCache(Objects.requireNonNull(config, "config must not be null"));
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.evaluationTimer = metrics.timer(EVALUATION_METRIC);
    }

    /**
     * Decides {@code request} without modifying {@code store}.
     */
    public Decision evaluate(ValidatedPolicy policy, EvaluationRequest request, StateStore store) {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(store, "store must not be null");

        Decision decision = evaluationTimer.time(() -> decide(policy, request, store));
        metrics.counter(DECISIONS_METRIC, "outcome", decision.outcome()).increment();
        if (logger.isDebugEnabled()) {
            logger.debug("{} -> {} (rule {})", request.subjectKey(), decision.outcome(), decision.ruleId());
        }
        return decision;
    }

    /**
     * Records {@code request} in every rate window and spending window of {@code policy}.
     * Windows are created on first use.
     */
    public void commit(ValidatedPolicy policy, EvaluationRequest request, StateStore store) {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(store, "store must not be null");

        String subject = request.subjectKey();
        Instant now = request.timestamp();
        for (Rule.RateLimit limit : policy.rateLimits()) {
            store.rateWindowFor(new StateKey(limit.ruleId(), subject))
                    .record(now, limit.windowSeconds());
        }
        for (Rule.SpendingCap cap : policy.spendingCaps()) {
            store.spendingWindowFor(new StateKey(cap.ruleId(), subject))
                    .add(now, cap.windowSeconds(), request.estimatedCost());
        }
        metrics.counter(COMMITS_METRIC).increment();
        metrics.gauge(STATE_ENTRIES_METRIC).set(store.size());
    }

    private Decision decide(ValidatedPolicy policy, EvaluationRequest request, StateStore store) {
        Map<SubjectField, String> attributes = request.attributes();
        SubjectListMatcher matcher = matchCache.matcherFor(policy);

        Map<SubjectField, ListMatch> listMatches = new EnumMap<>(SubjectField.class);
        ListMatch firstDenied = null;
        for (Map.Entry<SubjectField, String> attribute : attributes.entrySet()) {
            ListMatch match = matcher.match(attribute.getKey(), attribute.getValue());
            listMatches.put(attribute.getKey(), match);
            if (match.isDenied() && (firstDenied == null || match.denyRuleOrder() < firstDenied.denyRuleOrder())) {
                firstDenied = match;
            }
        }
        if (firstDenied != null) {
            return new Decision.Deny(Decision.REASON_DENYLISTED, firstDenied.denyRuleId());
        }

        Map<SubjectField, String> authoritative = new EnumMap<>(SubjectField.class);
        for (Map.Entry<SubjectField, ListMatch> entry : listMatches.entrySet()) {
            ListMatch match = entry.getValue();
            if (match.isRejectedByAllowlist()) {
                return new Decision.Deny(Decision.REASON_NOT_ALLOWLISTED,
                        matcher.allowlistRuleId(entry.getKey()).orElseThrow());
            }
            if (match.isAllowlisted()) {
                authoritative.put(entry.getKey(), match.authoritativePattern());
            }
        }

        String subject = request.subjectKey();
        Instant now = request.timestamp();

        for (Rule.RateLimit limit : policy.rateLimits()) {
            long retryAfter = store.findRateWindow(new StateKey(limit.ruleId(), subject))
                    .map(window -> window.retryAfterSeconds(now, limit.maxRequests(), limit.windowSeconds()))
                    .orElse(0L);
            if (retryAfter > 0) {
                return new Decision.RateLimited(retryAfter, limit.ruleId());
            }
        }

        BigDecimal cost = request.estimatedCost();
        for (Rule.SpendingCap cap : policy.spendingCaps()) {
            BigDecimal current = store.findSpendingWindow(new StateKey(cap.ruleId(), subject))
                    .map(window -> window.currentSpend(now, cap.windowSeconds()))
                    .orElse(BigDecimal.ZERO);
            if (current.add(cost).compareTo(cap.maxAmount()) > 0) {
                BigDecimal remaining = cap.maxAmount().subtract(current).max(BigDecimal.ZERO);
                return new Decision.SpendingCapExceeded(current, cap.maxAmount(), remaining, cap.currency(),
                        cap.ruleId());
            }
        }

        return authoritative.isEmpty() ? Decision.allow() : new Decision.Allow(authoritative);
    }
}
