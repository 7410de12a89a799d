/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.ir;

import com.tollgate.policyengine.api.exceptions.InternalEngineException;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Lowers a validated policy into an {@link EnforcementPlan}.
 */
public class PlanBuilder {

    /**
     * Lower bound for {@link EnforcementPlan#amountScale()}; request costs are rounded up to it.
     */
    public static final int MIN_AMOUNT_SCALE = 6;

    private static final Comparator<StageEntry> PLAN_ORDER =
            Comparator.comparing(StageEntry::stage).thenComparingInt(StageEntry::ruleIndex);

    private final Tracer tracer;

    public PlanBuilder() {
        this(OpenTelemetry.noop().getTracer("tollgate-codegen"));
    }

    public PlanBuilder(Tracer tracer) {
        this.tracer = tracer;
    }

    public EnforcementPlan build(ValidatedPolicy policy) {
        Span span = tracer.spanBuilder("build-enforcement-plan").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<Rule> rules = policy.rules();
            List<StageEntry> entries = new ArrayList<>(rules.size());
            for (int i = 0; i < rules.size(); i++) {
                entries.add(new StageEntry(Stage.of(rules.get(i)), i, rules.get(i)));
            }
            entries.sort(PLAN_ORDER);

            String rulesJson = CanonicalJson.rules(rules);
            String fingerprint = sha256(rulesJson);
            span.setAttribute("ruleCount", rules.size());
            span.setAttribute("fingerprint", fingerprint);

            return new EnforcementPlan(
                    policy.policy().version(),
                    rules,
                    entries,
                    policy.policy().pricing(),
                    policy.policy().audit(),
                    amountScale(policy),
                    rulesJson,
                    fingerprint);
        } finally {
            span.end();
        }
    }

    private static int amountScale(ValidatedPolicy policy) {
        int scale = Math.max(MIN_AMOUNT_SCALE, policy.policy().pricing().amount().scale());
        for (Rule.SpendingCap cap : policy.spendingCaps()) {
            scale = Math.max(scale, cap.maxAmount().scale());
        }
        return scale;
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new InternalEngineException("SHA-256 is not available", e);
        }
    }
}
