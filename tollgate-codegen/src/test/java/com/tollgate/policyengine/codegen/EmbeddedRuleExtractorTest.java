/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen;

import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.SubjectField;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tollgate.policyengine.codegen.render.FrameworkRenderer.RULES_BEGIN_MARKER;
import static com.tollgate.policyengine.codegen.render.FrameworkRenderer.RULES_END_MARKER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddedRuleExtractorTest {

    private final EmbeddedRuleExtractor extractor = new EmbeddedRuleExtractor();

    @Test
    void readsRulesBetweenMarkers() {
        String source = "const RULES = " + RULES_BEGIN_MARKER
                + "[{\"type\":\"denylist\",\"id\":\"d\",\"field\":\"agent_id\",\"values\":[\"x\"]},"
                + "{\"type\":\"rate_limit\",\"max_requests\":3,\"window_seconds\":10}]"
                + RULES_END_MARKER + ";";

        assertThat(extractor.extract(source)).containsExactly(
                new Rule.Denylist("d", SubjectField.AGENT_ID, List.of("x")),
                new Rule.RateLimit("rate_limit-1", 3, 10));
    }

    @Test
    void requiresBothMarkers() {
        assertThatThrownBy(() -> extractor.extract("module.exports = {};"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> extractor.extract(RULES_BEGIN_MARKER + "[]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not terminated");
    }

    @Test
    void rejectsMalformedContent() {
        assertThatThrownBy(() -> extractor.extract(RULES_BEGIN_MARKER + "[{" + RULES_END_MARKER))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageStartingWith("Malformed embedded rules");
        assertThatThrownBy(() -> extractor.extract(RULES_BEGIN_MARKER + "{}" + RULES_END_MARKER))
                .isInstanceOf(PolicyParseException.class)
                .hasMessage("Embedded rules must be an array");
        assertThatThrownBy(() -> extractor.extract(RULES_BEGIN_MARKER
                + "[{\"type\":\"rate_limit\",\"max_requests\":1,\"max_requests\":2,\"window_seconds\":10}]"
                + RULES_END_MARKER))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("Duplicate field 'max_requests'");
    }
}
