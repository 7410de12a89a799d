/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import com.tollgate.policyengine.api.pattern.ValuePattern;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * One enforcement unit of a policy.
 *
 * <p>The set of rule kinds is closed: a rule is an {@link Allowlist}, a {@link Denylist},
 * a {@link RateLimit} or a {@link SpendingCap}. Each variant is self-contained and
 * immutable. Values are checked for shape by the parser and for consistency by the
 * validator; the records themselves only reject nulls.
 *
 * <p>Every rule carries a {@code ruleId}, either configured explicitly or derived from
 * its type and position (see {@link #defaultId(RuleType, int)}). The id keys runtime
 * state, appears in decisions and audit records, and is embedded in generated code.
 */
public sealed interface Rule permits Rule.ListRule, Rule.RateLimit, Rule.SpendingCap {

    String ruleId();

    RuleType type();

    /**
     * Derives the id used when a rule does not configure one, e.g. {@code rate_limit-2}.
     */
    static String defaultId(RuleType type, int index) {
        return type.tag() + "-" + index;
    }

    /**
     * Common shape of allow and deny lists.
     */
    sealed interface ListRule extends Rule permits Allowlist, Denylist {

        SubjectField field();

        List<String> values();

        default List<ValuePattern> patterns() {
            return values().stream().map(ValuePattern::of).toList();
        }
    }

    record Allowlist(String ruleId, SubjectField field, List<String> values) implements ListRule {
        public Allowlist {
            Objects.requireNonNull(ruleId, "ruleId must not be null");
            Objects.requireNonNull(field, "field must not be null");
            values = List.copyOf(values);
        }

        @Override
        public RuleType type() {
            return RuleType.ALLOWLIST;
        }
    }

    record Denylist(String ruleId, SubjectField field, List<String> values) implements ListRule {
        public Denylist {
            Objects.requireNonNull(ruleId, "ruleId must not be null");
            Objects.requireNonNull(field, "field must not be null");
            values = List.copyOf(values);
        }

        @Override
        public RuleType type() {
            return RuleType.DENYLIST;
        }
    }

    record RateLimit(String ruleId, long maxRequests, long windowSeconds) implements Rule {
        public RateLimit {
            Objects.requireNonNull(ruleId, "ruleId must not be null");
        }

        @Override
        public RuleType type() {
            return RuleType.RATE_LIMIT;
        }
    }

    /**
     * Spending cap over a fixed window. {@code maxAmount} is normalized with
     * {@link Amounts#normalize(BigDecimal)} so that {@code 10}, {@code 10.0} and
     * {@code 10.00} produce equal rules.
     */
    record SpendingCap(String ruleId, BigDecimal maxAmount, String currency, long windowSeconds) implements Rule {
        public SpendingCap {
            Objects.requireNonNull(ruleId, "ruleId must not be null");
            Objects.requireNonNull(maxAmount, "maxAmount must not be null");
            Objects.requireNonNull(currency, "currency must not be null");
            maxAmount = Amounts.normalize(maxAmount);
        }

        @Override
        public RuleType type() {
            return RuleType.SPENDING_CAP;
        }
    }
}
