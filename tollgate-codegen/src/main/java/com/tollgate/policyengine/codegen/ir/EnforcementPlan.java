/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.ir;

import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;

import java.util.List;

/**
 * Target-independent description of the middleware to generate.
 *
 * <p>{@code entries} hold every rule exactly once, ordered by stage and then by policy position.
 * {@code rules} keeps policy order, which is the order rules are embedded in generated code.
 *
 * @param amountScale fractional digits generated code uses for fixed-point amounts
 * @param rulesJson   canonical JSON of {@code rules}, embedded verbatim
 * @param fingerprint hex SHA-256 of {@code rulesJson}
 */
public record EnforcementPlan(String version,
                              List<Rule> rules,
                              List<StageEntry> entries,
                              Policy.Pricing pricing,
                              Policy.Audit audit,
                              int amountScale,
                              String rulesJson,
                              String fingerprint) {

    public EnforcementPlan {
        rules = List.copyOf(rules);
        entries = List.copyOf(entries);
    }

    public List<StageEntry> entriesFor(Stage stage) {
        return entries.stream().filter(e -> e.stage() == stage).toList();
    }
}
