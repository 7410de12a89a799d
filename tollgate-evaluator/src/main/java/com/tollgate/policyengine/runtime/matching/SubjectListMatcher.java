/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.matching;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.SubjectField;
import com.tollgate.policyengine.api.pattern.ValuePattern;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Allow and deny lists of one policy, grouped by field.
 *
 * <p>Matching is a pure function of {@code (field, value)} for a given policy, so results are
 * memoized in a bounded Caffeine cache when {@code cacheSize > 0}.
 */
public final class SubjectListMatcher {

    private final Map<SubjectField, List<DenyEntry>> denyEntries = new EnumMap<>(SubjectField.class);
    private final Map<SubjectField, Set<ValuePattern>> allowPatterns = new EnumMap<>(SubjectField.class);
    private final Map<SubjectField, String> firstAllowlistRuleId = new EnumMap<>(SubjectField.class);
    private final Cache<MatchKey, ListMatch> matches;

    public SubjectListMatcher(ValidatedPolicy policy, long cacheSize, boolean recordStats) {
        List<Rule> rules = policy.rules();
        for (int order = 0; order < rules.size(); order++) {
            Rule rule = rules.get(order);
            if (rule instanceof Rule.Denylist deny) {
                List<DenyEntry> entries = denyEntries.computeIfAbsent(deny.field(), f -> new ArrayList<>());
                for (ValuePattern pattern : deny.patterns()) {
                    entries.add(new DenyEntry(pattern, deny.ruleId(), order));
                }
            } else if (rule instanceof Rule.Allowlist allow) {
                allowPatterns.computeIfAbsent(allow.field(), f -> new LinkedHashSet<>()).addAll(allow.patterns());
                firstAllowlistRuleId.putIfAbsent(allow.field(), allow.ruleId());
            }
        }
        if (cacheSize > 0) {
            Caffeine<Object, Object> builder = Caffeine.newBuilder().maximumSize(cacheSize);
            if (recordStats) {
                builder.recordStats();
            }
            this.matches = builder.build();
        } else {
            this.matches = null;
        }
    }

    public ListMatch match(SubjectField field, String value) {
        if (matches == null) {
            return compute(field, value);
        }
        return matches.get(new MatchKey(field, value), key -> compute(key.field(), key.value()));
    }

    /**
     * Id of the first allowlist rule for {@code field}, reported when a value is not allowlisted.
     */
    public Optional<String> allowlistRuleId(SubjectField field) {
        return Optional.ofNullable(firstAllowlistRuleId.get(field));
    }

    public Optional<CacheStats> cacheStats() {
        return matches == null ? Optional.empty() : Optional.of(matches.stats());
    }

    private ListMatch compute(SubjectField field, String value) {
        String denyRuleId = null;
        int denyOrder = Integer.MAX_VALUE;
        for (DenyEntry entry : denyEntries.getOrDefault(field, List.of())) {
            if (entry.order() < denyOrder && entry.pattern().matches(value)) {
                denyRuleId = entry.ruleId();
                denyOrder = entry.order();
            }
        }
        Set<ValuePattern> allowed = allowPatterns.get(field);
        String authoritative = allowed == null ? null
                : ValuePattern.mostSpecificMatch(allowed, value).map(ValuePattern::raw).orElse(null);
        return new ListMatch(denyRuleId, denyOrder, allowed != null, authoritative);
    }

    private record DenyEntry(ValuePattern pattern, String ruleId, int order) {
    }

    private record MatchKey(SubjectField field, String value) {
    }
}
