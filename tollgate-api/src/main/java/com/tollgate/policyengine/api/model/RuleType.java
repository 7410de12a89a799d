/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Type tags accepted in the {@code type} key of a policy rule.
 */
public enum RuleType {
    ALLOWLIST("allowlist"),
    DENYLIST("denylist"),
    RATE_LIMIT("rate_limit"),
    SPENDING_CAP("spending_cap");

    private final String tag;

    RuleType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<RuleType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(tag))
                .findFirst();
    }

    public static List<String> tags() {
        return Arrays.stream(values()).map(RuleType::tag).toList();
    }

    @Override
    public String toString() {
        return tag;
    }
}
