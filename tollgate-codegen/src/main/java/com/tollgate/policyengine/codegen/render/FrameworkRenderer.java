/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.render;

import com.tollgate.policyengine.codegen.ir.EnforcementPlan;

/**
 * Renders an {@link EnforcementPlan} as middleware source for one web framework.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; register them in
 * {@code META-INF/services/com.tollgate.policyengine.codegen.render.FrameworkRenderer}.
 * Rendering must be deterministic: the same plan and source name always give the same text.
 */
public interface FrameworkRenderer {

    /**
     * Generated code embeds the rule array between these two comments.
     */
    String RULES_BEGIN_MARKER = "/* tollgate:rules:begin */";
    String RULES_END_MARKER = "/* tollgate:rules:end */";

    /**
     * Target name as accepted on the command line, lower case.
     */
    String name();

    /**
     * Suggested file name for the generated source.
     */
    String fileName();

    String render(EnforcementPlan plan, String sourceName);
}
