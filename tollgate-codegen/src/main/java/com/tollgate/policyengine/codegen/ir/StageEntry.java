/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.ir;

import com.tollgate.policyengine.api.model.Rule;

/**
 * One rule placed in its stage.
 *
 * @param ruleIndex position of the rule in the policy, and in the embedded rule array
 */
public record StageEntry(Stage stage, int ruleIndex, Rule rule) {

    public String ruleId() {
        return rule.ruleId();
    }

    @SuppressWarnings("unchecked")
    public <T extends Rule> T ruleAs(Class<T> type) {
        if (!type.isInstance(rule)) {
            throw new IllegalStateException("Entry " + ruleIndex + " is a " + rule.type() + " rule, not " + type.getSimpleName());
        }
        return (T) rule;
    }
}
