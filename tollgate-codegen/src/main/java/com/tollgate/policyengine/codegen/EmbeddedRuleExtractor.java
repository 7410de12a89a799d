/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.codegen.render.FrameworkRenderer;
import com.tollgate.policyengine.compiler.PolicyParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the rule array back out of generated source, through the same rule parser that reads
 * policy files.
 */
public class EmbeddedRuleExtractor {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    private final PolicyParser parser;

    public EmbeddedRuleExtractor() {
        this(new PolicyParser());
    }

    public EmbeddedRuleExtractor(PolicyParser parser) {
        this.parser = parser;
    }

    /**
     * @throws IllegalArgumentException if {@code source} carries no embedded rules
     * @throws PolicyParseException     if the embedded rules are malformed
     */
    public List<Rule> extract(String source) {
        int begin = source.indexOf(FrameworkRenderer.RULES_BEGIN_MARKER);
        if (begin < 0) {
            throw new IllegalArgumentException("No embedded rules: marker "
                    + FrameworkRenderer.RULES_BEGIN_MARKER + " not found");
        }
        int start = begin + FrameworkRenderer.RULES_BEGIN_MARKER.length();
        int end = source.indexOf(FrameworkRenderer.RULES_END_MARKER, start);
        if (end < 0) {
            throw new IllegalArgumentException("Embedded rules are not terminated by "
                    + FrameworkRenderer.RULES_END_MARKER);
        }

        JsonNode array;
        try {
            array = MAPPER.readTree(source.substring(start, end));
        } catch (JsonProcessingException e) {
            throw new PolicyParseException("Malformed embedded rules: " + e.getOriginalMessage(), e);
        }
        if (array == null || !array.isArray()) {
            throw new PolicyParseException("Embedded rules must be an array",
                    PolicyParseException.DOCUMENT_LEVEL, "policies", "sequence");
        }
        List<Rule> rules = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            rules.add(parser.parseRule(array.get(i), i));
        }
        return rules;
    }
}
