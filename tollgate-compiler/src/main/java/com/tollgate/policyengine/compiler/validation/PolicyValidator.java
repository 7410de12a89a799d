/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.validation;

import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.pattern.ValuePattern;
import com.tollgate.policyengine.compiler.analysis.RuleConflictAnalyzer;
import com.tollgate.policyengine.compiler.analysis.RuleConflictAnalyzer.ConflictReport;
import com.tollgate.policyengine.compiler.analysis.RuleConflictAnalyzer.RuleConflict;
import com.tollgate.policyengine.compiler.analysis.RuleConflictAnalyzer.ShadowedValue;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a parsed {@link Policy} for semantic errors and likely mistakes.
 *
 * <p>Every check runs and every finding is collected; nothing fails fast. The result carries a
 * {@link ValidatedPolicy} only when no finding has {@link Severity#ERROR} severity.
 *
 * <p>Validation is pure: the same policy always yields the same issues in the same order.
 */
public class PolicyValidator {
    private static final Logger logger = LoggerFactory.getLogger(PolicyValidator.class);

    public static final long MIN_WINDOW_SECONDS = 1;
    public static final long MAX_WINDOW_SECONDS = 31_536_000;
    public static final Set<String> AUDIT_FORMATS = Set.of("json", "csv");

    private final RuleConflictAnalyzer conflictAnalyzer = new RuleConflictAnalyzer();
    private final Tracer tracer;

    public PolicyValidator() {
        this(OpenTelemetry.noop().getTracer("tollgate-compiler"));
    }

    public PolicyValidator(Tracer tracer) {
        this.tracer = tracer;
    }

    public ValidationResult validate(Policy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        Span span = tracer.spanBuilder("validate-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<ValidationIssue> issues = new ArrayList<>();
            List<Rule> rules = policy.rules();

            if (rules.isEmpty()) {
                issues.add(ValidationIssue.error(IssueCode.EMPTY_POLICY,
                        "Policy defines no rules", List.of(),
                        "Add at least one rule under 'policies'"));
            }

            checkDuplicateIds(rules, issues);
            for (int i = 0; i < rules.size(); i++) {
                checkRule(rules.get(i), i, issues);
            }
            checkConflicts(policy, issues);
            checkMultipleRateLimits(rules, issues);
            checkMultipleSpendingCaps(rules, issues);
            checkPricing(policy.pricing(), issues);
            checkAudit(policy.audit(), issues);

            List<ValidationIssue> warnings = issues.stream().filter(i -> !i.isError()).toList();
            boolean valid = warnings.size() == issues.size();
            span.setAttribute("issueCount", issues.size());
            span.setAttribute("valid", valid);

            if (valid) {
                logger.debug("Policy valid: {} rules, {} warnings", rules.size(), warnings.size());
                return new ValidationResult(issues, new ValidatedPolicy(policy, warnings));
            }
            logger.debug("Policy invalid: {} errors, {} warnings",
                    issues.size() - warnings.size(), warnings.size());
            return new ValidationResult(issues, null);
        } finally {
            span.end();
        }
    }

    /**
     * @throws PolicyValidationException with every error when the policy is invalid
     */
    public ValidatedPolicy validateOrThrow(Policy policy) {
        return validate(policy).orElseThrow();
    }

    private void checkDuplicateIds(List<Rule> rules, List<ValidationIssue> issues) {
        Map<String, List<Integer>> byId = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            byId.computeIfAbsent(rules.get(i).ruleId(), k -> new ArrayList<>()).add(i);
        }
        byId.forEach((id, indices) -> {
            if (indices.size() > 1) {
                issues.add(ValidationIssue.error(IssueCode.DUPLICATE_RULE_ID,
                        "Rule id '" + id + "' is used by " + indices.size() + " rules", indices,
                        "Give each rule a unique 'id'"));
            }
        });
    }

    private void checkRule(Rule rule, int index, List<ValidationIssue> issues) {
        if (rule instanceof Rule.ListRule list) {
            checkListRule(list, index, issues);
        } else if (rule instanceof Rule.RateLimit rateLimit) {
            if (rateLimit.maxRequests() < 1) {
                issues.add(ValidationIssue.error(IssueCode.INVALID_MAX_REQUESTS,
                        "max_requests must be at least 1, got " + rateLimit.maxRequests(), List.of(index),
                        "Set max_requests to a positive integer"));
            }
            checkWindow(rateLimit.windowSeconds(), index, issues);
        } else if (rule instanceof Rule.SpendingCap cap) {
            if (cap.maxAmount().signum() <= 0) {
                issues.add(ValidationIssue.error(IssueCode.INVALID_MAX_AMOUNT,
                        "max_amount must be greater than 0, got " + cap.maxAmount().toPlainString(),
                        List.of(index), "Set max_amount to a positive amount"));
            }
            if (cap.currency().isBlank()) {
                issues.add(ValidationIssue.error(IssueCode.BLANK_CURRENCY,
                        "currency must not be blank", List.of(index), "Set currency, e.g. USDC"));
            }
            checkWindow(cap.windowSeconds(), index, issues);
        }
    }

    private void checkListRule(Rule.ListRule rule, int index, List<ValidationIssue> issues) {
        if (rule.values().isEmpty()) {
            issues.add(ValidationIssue.error(IssueCode.EMPTY_VALUES,
                    rule.type() + " for field " + rule.field() + " has no values", List.of(index),
                    "Add at least one value or remove the rule"));
            return;
        }
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String value : rule.values()) {
            if (!seen.add(value)) {
                duplicates.add(value);
            }
            if (value.isEmpty()) {
                issues.add(ValidationIssue.error(IssueCode.INVALID_PATTERN,
                        rule.type() + " for field " + rule.field() + " contains an empty value",
                        List.of(index), "Remove the empty value"));
            } else if (!ValuePattern.of(value).isWellFormed()) {
                issues.add(ValidationIssue.error(IssueCode.INVALID_PATTERN,
                        "Pattern '" + value + "' is invalid: '*' is only allowed as the last character",
                        List.of(index), "Use a trailing wildcard such as '" + value.replace("*", "") + "*'"));
            }
        }
        for (String duplicate : duplicates) {
            issues.add(ValidationIssue.warning(IssueCode.DUPLICATE_VALUE,
                    "Value '" + duplicate + "' appears more than once in " + rule.type(), List.of(index),
                    "Remove the duplicate entry"));
        }
    }

    private void checkWindow(long windowSeconds, int index, List<ValidationIssue> issues) {
        if (windowSeconds < MIN_WINDOW_SECONDS || windowSeconds > MAX_WINDOW_SECONDS) {
            issues.add(ValidationIssue.error(IssueCode.WINDOW_OUT_OF_RANGE,
                    "window_seconds must be between " + MIN_WINDOW_SECONDS + " and " + MAX_WINDOW_SECONDS
                            + ", got " + windowSeconds,
                    List.of(index), "Use a window between 1 second and 1 year"));
        }
    }

    private void checkConflicts(Policy policy, List<ValidationIssue> issues) {
        ConflictReport report = conflictAnalyzer.analyze(policy);
        for (RuleConflict conflict : report.conflicts()) {
            issues.add(ValidationIssue.error(IssueCode.ALLOW_DENY_CONFLICT,
                    conflict.describe(), conflict.ruleIndices(),
                    "Remove '" + conflict.value() + "' from the denylist (rule "
                            + conflict.denyRuleIndices().get(0) + ")",
                    "Remove '" + conflict.value() + "' from the allowlist (rule "
                            + conflict.allowRuleIndices().get(0) + ")"));
        }
        for (ShadowedValue shadow : report.shadowed()) {
            issues.add(ValidationIssue.warning(IssueCode.SHADOWED_ALLOW_VALUE,
                    shadow.describe(), shadow.ruleIndices(),
                    "Narrow denylist pattern '" + shadow.denyPattern() + "'",
                    "Remove '" + shadow.allowValue() + "' from the allowlist"));
        }
    }

    private void checkMultipleRateLimits(List<Rule> rules, List<ValidationIssue> issues) {
        List<Integer> indices = indicesOf(rules, Rule.RateLimit.class);
        if (indices.size() < 2) {
            return;
        }
        int strictest = indices.get(0);
        for (int index : indices) {
            Rule.RateLimit candidate = (Rule.RateLimit) rules.get(index);
            Rule.RateLimit current = (Rule.RateLimit) rules.get(strictest);
            // candidate.max / candidate.window < current.max / current.window
            BigInteger lhs = BigInteger.valueOf(candidate.maxRequests()).multiply(BigInteger.valueOf(current.windowSeconds()));
            BigInteger rhs = BigInteger.valueOf(current.maxRequests()).multiply(BigInteger.valueOf(candidate.windowSeconds()));
            if (lhs.compareTo(rhs) < 0) {
                strictest = index;
            }
        }
        Rule.RateLimit winner = (Rule.RateLimit) rules.get(strictest);
        issues.add(ValidationIssue.warning(IssueCode.MULTIPLE_RATE_LIMITS,
                "Multiple rate limits are defined; all are enforced and the most restrictive is rule "
                        + strictest + " ('" + winner.ruleId() + "': " + winner.maxRequests() + " requests per "
                        + winner.windowSeconds() + "s)",
                indices, "Merge the rate limits into a single rule"));
    }

    private void checkMultipleSpendingCaps(List<Rule> rules, List<ValidationIssue> issues) {
        List<Integer> indices = indicesOf(rules, Rule.SpendingCap.class);
        if (indices.size() < 2) {
            return;
        }
        int strictest = indices.get(0);
        for (int index : indices) {
            Rule.SpendingCap candidate = (Rule.SpendingCap) rules.get(index);
            Rule.SpendingCap current = (Rule.SpendingCap) rules.get(strictest);
            BigDecimal lhs = candidate.maxAmount().multiply(BigDecimal.valueOf(current.windowSeconds()));
            BigDecimal rhs = current.maxAmount().multiply(BigDecimal.valueOf(candidate.windowSeconds()));
            if (lhs.compareTo(rhs) < 0) {
                strictest = index;
            }
        }
        Rule.SpendingCap winner = (Rule.SpendingCap) rules.get(strictest);
        issues.add(ValidationIssue.warning(IssueCode.MULTIPLE_SPENDING_CAPS,
                "Multiple spending caps are defined; all are enforced and the most restrictive is rule "
                        + strictest + " ('" + winner.ruleId() + "': " + winner.maxAmount().toPlainString() + " "
                        + winner.currency() + " per " + winner.windowSeconds() + "s)",
                indices, "Merge the spending caps into a single rule"));
    }

    private void checkPricing(Policy.Pricing pricing, List<ValidationIssue> issues) {
        if (pricing.amount().signum() <= 0) {
            issues.add(ValidationIssue.error(IssueCode.INVALID_PRICING,
                    "pricing.amount must be greater than 0, got " + pricing.amount().toPlainString(),
                    List.of(), "Set pricing.amount to a positive amount"));
        }
        if (pricing.currency().isBlank()) {
            issues.add(ValidationIssue.error(IssueCode.INVALID_PRICING,
                    "pricing.currency must not be blank", List.of(), "Set pricing.currency, e.g. USDC"));
        }
    }

    private void checkAudit(Policy.Audit audit, List<ValidationIssue> issues) {
        if (!AUDIT_FORMATS.contains(audit.format())) {
            issues.add(ValidationIssue.error(IssueCode.INVALID_AUDIT_FORMAT,
                    "audit.format must be one of json, csv; got '" + audit.format() + "'",
                    List.of(), "Use audit.format: json"));
        }
    }

    private static List<Integer> indicesOf(List<Rule> rules, Class<? extends Rule> kind) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            if (kind.isInstance(rules.get(i))) {
                indices.add(i);
            }
        }
        return indices;
    }
}
