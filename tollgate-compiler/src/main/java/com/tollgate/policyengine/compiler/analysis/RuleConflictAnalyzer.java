/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler.analysis;

import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.SubjectField;
import com.tollgate.policyengine.api.pattern.ValuePattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Finds allowlist entries that can never take effect because of a denylist on the same field.
 *
 * <h2>Conflicts</h2>
 * <p>A value listed verbatim in both an allowlist and a denylist for the same field is a
 * conflict. Deny wins at runtime, so the allow entry is dead. Conflicts are reported once per
 * value, with every allow and deny rule that lists it.
 *
 * <h2>Shadowing</h2>
 * <p>An allowlist entry matched entirely by a different wildcard denylist pattern (for example
 * {@code bad-agent} under {@code bad*}) is shadowed: it is just as unreachable, but the
 * overlap is less obvious, so it is reported separately and with lower severity.
 *
 * <h2>Usage</h2>
 * <pre>
 * ConflictReport report = new RuleConflictAnalyzer().analyze(policy);
 * for (RuleConflict conflict : report.conflicts()) {
 *     System.out.println(conflict.describe());
 * }
 * </pre>
 *
 * <p>Cost is proportional to the product of allow and deny entries per field, which is small for
 * any hand-written policy.
 */
public class RuleConflictAnalyzer {

    public ConflictReport analyze(Policy policy) {
        List<RuleConflict> conflicts = new ArrayList<>();
        List<ShadowedValue> shadowed = new ArrayList<>();

        List<Rule> rules = policy.rules();
        for (SubjectField field : SubjectField.values()) {
            Map<String, TreeSet<Integer>> allowed = indexValues(rules, field, Rule.Allowlist.class);
            Map<String, TreeSet<Integer>> denied = indexValues(rules, field, Rule.Denylist.class);
            if (allowed.isEmpty() || denied.isEmpty()) {
                continue;
            }

            for (Map.Entry<String, TreeSet<Integer>> allow : allowed.entrySet()) {
                String value = allow.getKey();
                TreeSet<Integer> denyIndices = denied.get(value);
                if (denyIndices != null) {
                    conflicts.add(new RuleConflict(field, value,
                            List.copyOf(allow.getValue()), List.copyOf(denyIndices)));
                    continue;
                }
                ValuePattern allowPattern = ValuePattern.of(value);
                for (Map.Entry<String, TreeSet<Integer>> deny : denied.entrySet()) {
                    ValuePattern denyPattern = ValuePattern.of(deny.getKey());
                    if (denyPattern.isWildcard() && denyPattern.covers(allowPattern)) {
                        shadowed.add(new ShadowedValue(field, value, List.copyOf(allow.getValue()),
                                deny.getKey(), List.copyOf(deny.getValue())));
                        break;
                    }
                }
            }
        }

        return new ConflictReport(conflicts, shadowed);
    }

    private static <T extends Rule.ListRule> Map<String, TreeSet<Integer>> indexValues(
            List<Rule> rules, SubjectField field, Class<T> kind) {
        Map<String, TreeSet<Integer>> index = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (kind.isInstance(rule) && kind.cast(rule).field() == field) {
                for (String value : kind.cast(rule).values()) {
                    index.computeIfAbsent(value, v -> new TreeSet<>()).add(i);
                }
            }
        }
        return index;
    }

    /**
     * Outcome of an analysis run.
     */
    public record ConflictReport(List<RuleConflict> conflicts, List<ShadowedValue> shadowed) {

        public ConflictReport {
            conflicts = List.copyOf(conflicts);
            shadowed = List.copyOf(shadowed);
        }

        public boolean hasConflicts() {
            return !conflicts.isEmpty();
        }

        public int conflictCount() {
            return conflicts.size();
        }
    }

    /**
     * A value present in both an allowlist and a denylist for the same field.
     */
    public record RuleConflict(SubjectField field,
                               String value,
                               List<Integer> allowRuleIndices,
                               List<Integer> denyRuleIndices) {

        public List<Integer> ruleIndices() {
            List<Integer> all = new ArrayList<>(allowRuleIndices);
            all.addAll(denyRuleIndices);
            return all;
        }

        public String describe() {
            return String.format("Value '%s' for field %s is in allowlist (rule %s) and denylist (rule %s); "
                            + "deny wins at runtime",
                    value, field, join(allowRuleIndices), join(denyRuleIndices));
        }
    }

    /**
     * An allowlist entry that a wildcard denylist pattern always matches first.
     */
    public record ShadowedValue(SubjectField field,
                                String allowValue,
                                List<Integer> allowRuleIndices,
                                String denyPattern,
                                List<Integer> denyRuleIndices) {

        public List<Integer> ruleIndices() {
            List<Integer> all = new ArrayList<>(allowRuleIndices);
            all.addAll(denyRuleIndices);
            return all;
        }

        public String describe() {
            return String.format("Allowlist value '%s' for field %s (rule %s) is unreachable: "
                            + "denylist pattern '%s' (rule %s) matches it",
                    allowValue, field, join(allowRuleIndices), denyPattern, join(denyRuleIndices));
        }
    }

    private static String join(List<Integer> indices) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indices.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(indices.get(i));
        }
        return sb.toString();
    }
}
