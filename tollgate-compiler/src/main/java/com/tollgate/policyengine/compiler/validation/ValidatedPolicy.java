/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.validation;

import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;

import java.util.List;
import java.util.Objects;

/**
 * A policy that passed validation.
 *
 * <p>Only {@link PolicyValidator} creates instances, so holding one is proof that every check
 * passed. Immutable and safe to share between threads; runtime state lives elsewhere.
 */
public final class ValidatedPolicy {

    private final Policy policy;
    private final List<ValidationIssue> warnings;
    private final List<Rule.Denylist> denylists;
    private final List<Rule.Allowlist> allowlists;
    private final List<Rule.RateLimit> rateLimits;
    private final List<Rule.SpendingCap> spendingCaps;

    ValidatedPolicy(Policy policy, List<ValidationIssue> warnings) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.warnings = List.copyOf(warnings);
        this.denylists = policy.rulesOfType(Rule.Denylist.class);
        this.allowlists = policy.rulesOfType(Rule.Allowlist.class);
        this.rateLimits = policy.rulesOfType(Rule.RateLimit.class);
        this.spendingCaps = policy.rulesOfType(Rule.SpendingCap.class);
    }

    public Policy policy() {
        return policy;
    }

    public List<Rule> rules() {
        return policy.rules();
    }

    public List<ValidationIssue> warnings() {
        return warnings;
    }

    public List<Rule.Denylist> denylists() {
        return denylists;
    }

    public List<Rule.Allowlist> allowlists() {
        return allowlists;
    }

    public List<Rule.RateLimit> rateLimits() {
        return rateLimits;
    }

    public List<Rule.SpendingCap> spendingCaps() {
        return spendingCaps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidatedPolicy)) return false;
        return policy.equals(((ValidatedPolicy) o).policy);
    }

    @Override
    public int hashCode() {
        return policy.hashCode();
    }

    @Override
    public String toString() {
        return "ValidatedPolicy{version=" + policy.version() + ", rules=" + policy.rules().size()
                + ", warnings=" + warnings.size() + '}';
    }
}
