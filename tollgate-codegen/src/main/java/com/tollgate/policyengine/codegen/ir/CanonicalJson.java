/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tollgate.policyengine.api.exceptions.InternalEngineException;
import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;

import java.util.List;

/**
 * Writes rules and settings as compact JSON that is also a valid JavaScript literal.
 *
 * <p>Keys use the policy file names, so the output can be read back by the policy parser.
 * {@code *} is written as a unicode escape; embedded values can then never close a
 * surrounding block comment.
 */
public final class CanonicalJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    static {
        MAPPER.getFactory().setCharacterEscapes(new CommentSafeEscapes());
    }

    private CanonicalJson() {
        throw new AssertionError("No instances");
    }

    public static String rules(List<Rule> rules) {
        ArrayNode array = NODES.arrayNode();
        rules.forEach(rule -> array.add(rule(rule)));
        return write(array);
    }

    public static ObjectNode rule(Rule rule) {
        ObjectNode node = NODES.objectNode();
        node.put("type", rule.type().tag());
        node.put("id", rule.ruleId());
        if (rule instanceof Rule.ListRule list) {
            node.put("field", list.field().key());
            ArrayNode values = node.putArray("values");
            list.values().forEach(values::add);
        } else if (rule instanceof Rule.RateLimit limit) {
            node.put("max_requests", limit.maxRequests());
            node.put("window_seconds", limit.windowSeconds());
        } else if (rule instanceof Rule.SpendingCap cap) {
            node.put("max_amount", cap.maxAmount());
            node.put("currency", cap.currency());
            node.put("window_seconds", cap.windowSeconds());
        }
        return node;
    }

    /**
     * Pricing with the amount as a decimal string, so generated code never rounds it.
     */
    public static String pricing(Policy.Pricing pricing) {
        ObjectNode node = NODES.objectNode();
        node.put("amount", pricing.amount().toPlainString());
        node.put("currency", pricing.currency());
        node.put("memo_prefix", pricing.memoPrefix());
        return write(node);
    }

    public static String audit(Policy.Audit audit) {
        ObjectNode node = NODES.objectNode();
        node.put("enabled", audit.enabled());
        node.put("format", audit.format());
        node.put("destination", audit.destination());
        return write(node);
    }

    /**
     * Quoted string literal, valid in both JSON and JavaScript.
     */
    public static String string(String value) {
        return write(NODES.textNode(value));
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new InternalEngineException("Could not serialize " + node.getNodeType(), e);
        }
    }

    private static final class CommentSafeEscapes extends CharacterEscapes {
        private final int[] asciiEscapes;

        CommentSafeEscapes() {
            asciiEscapes = standardAsciiEscapesForJSON();
            asciiEscapes['*'] = ESCAPE_STANDARD;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return null;
        }
    }
}
