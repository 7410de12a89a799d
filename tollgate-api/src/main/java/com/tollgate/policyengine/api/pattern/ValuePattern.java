/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.pattern;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A list entry: either a literal value or a prefix pattern ending in a single {@code *}.
 *
 * <p>{@code "agent-*"} matches every value starting with {@code "agent-"}; {@code "*"} matches
 * everything. An asterisk anywhere but the last position is malformed; such patterns are
 * rejected by the validator and never match at runtime.
 *
 * <h2>Specificity</h2>
 * <p>When several patterns match the same value, the one with the longest literal prefix is the
 * most specific. A literal beats a wildcard with a prefix of equal length, so {@code "abc"}
 * beats {@code "abc*"}.
 */
public record ValuePattern(String raw) {

    public static final char WILDCARD = '*';

    /**
     * Orders patterns from least to most specific.
     */
    public static final Comparator<ValuePattern> SPECIFICITY =
            Comparator.comparingInt((ValuePattern p) -> p.literal().length())
                    .thenComparing(p -> !p.isWildcard());

    public ValuePattern {
        Objects.requireNonNull(raw, "pattern must not be null");
    }

    public static ValuePattern of(String raw) {
        return new ValuePattern(raw);
    }

    public boolean isWildcard() {
        return !raw.isEmpty() && raw.charAt(raw.length() - 1) == WILDCARD;
    }

    /**
     * The fixed part of the pattern: the whole value for literals, everything before the
     * trailing asterisk for wildcards.
     */
    public String literal() {
        return isWildcard() ? raw.substring(0, raw.length() - 1) : raw;
    }

    public boolean isWellFormed() {
        if (raw.isEmpty()) {
            return false;
        }
        int star = raw.indexOf(WILDCARD);
        return star < 0 || star == raw.length() - 1;
    }

    public boolean matches(String value) {
        if (value == null || !isWellFormed()) {
            return false;
        }
        return isWildcard() ? value.startsWith(literal()) : raw.equals(value);
    }

    /**
     * Returns true when every value matched by {@code other} is also matched by this pattern.
     */
    public boolean covers(ValuePattern other) {
        if (!isWellFormed() || !other.isWellFormed()) {
            return false;
        }
        if (!isWildcard()) {
            return !other.isWildcard() && raw.equals(other.raw);
        }
        return other.literal().startsWith(literal());
    }

    /**
     * Picks the most specific pattern among {@code patterns} that matches {@code value}.
     */
    public static Optional<ValuePattern> mostSpecificMatch(Collection<ValuePattern> patterns, String value) {
        return patterns.stream()
                .filter(p -> p.matches(value))
                .max(SPECIFICITY);
    }

    @Override
    public String toString() {
        return raw;
    }
}
