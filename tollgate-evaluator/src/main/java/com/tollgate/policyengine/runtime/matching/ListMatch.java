/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.matching;

/**
 * Result of matching one attribute value against the allow and deny lists of its field.
 *
 * @param denyRuleId           id of the first denylist rule (policy order) that matches, or null
 * @param denyRuleOrder        policy position of that rule, {@link Integer#MAX_VALUE} if none
 * @param allowlistApplies     whether any allowlist rule constrains this field
 * @param authoritativePattern most specific matching allowlist pattern, or null
 */
public record ListMatch(String denyRuleId,
                        int denyRuleOrder,
                        boolean allowlistApplies,
                        String authoritativePattern) {

    public boolean isDenied() {
        return denyRuleId != null;
    }

    public boolean isAllowlisted() {
        return authoritativePattern != null;
    }

    /**
     * True when an allowlist exists for the field and none of its entries matched.
     */
    public boolean isRejectedByAllowlist() {
        return allowlistApplies && authoritativePattern == null;
    }
}
