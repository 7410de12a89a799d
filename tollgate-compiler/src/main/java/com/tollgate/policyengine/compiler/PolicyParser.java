/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.RuleType;
import com.tollgate.policyengine.api.model.SubjectField;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Turns policy text (YAML, or JSON as a YAML subset) into a {@link Policy}.
 *
 * <p>The document is read as a Jackson tree and every node is checked explicitly, so no value is
 * ever coerced: {@code max_requests: "10"} is rejected rather than read as a number. Parsing is
 * fail-fast and reports the first offending construct through {@link PolicyParseException}.
 *
 * <p>The parser only checks shape. Bounds, patterns and cross-rule consistency are the
 * validator's job, so a document that parses may still be rejected later.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class PolicyParser {
    private static final Logger logger = LoggerFactory.getLogger(PolicyParser.class);

    private static final Set<String> DOCUMENT_KEYS = Set.of("version", "policies", "pricing", "audit");
    private static final Set<String> LIST_RULE_KEYS = Set.of("type", "id", "field", "values");
    private static final Set<String> RATE_LIMIT_KEYS = Set.of("type", "id", "max_requests", "window_seconds");
    private static final Set<String> SPENDING_CAP_KEYS =
            Set.of("type", "id", "max_amount", "currency", "window_seconds");
    private static final Set<String> PRICING_KEYS = Set.of("amount", "currency", "memo_prefix");
    private static final Set<String> AUDIT_KEYS = Set.of("enabled", "format", "destination");

    private static final int DOCUMENT = PolicyParseException.DOCUMENT_LEVEL;

    /**
     * Bound on integer and fractional digits of amounts, after trailing zeros are stripped.
     */
    private static final int MAX_AMOUNT_DIGITS = 38;

    private final ObjectMapper yamlMapper;
    private final Tracer tracer;

    public PolicyParser() {
        this(OpenTelemetry.noop().getTracer("tollgate-compiler"));
    }

    public PolicyParser(Tracer tracer) {
        this.tracer = tracer;
        this.yamlMapper = new ObjectMapper(YAMLFactory.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build())
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public Policy parse(Path policyPath) throws IOException {
        return parse(Files.readString(policyPath));
    }

    public Policy parse(String text) {
        Span span = tracer.spanBuilder("parse-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            JsonNode root = readTree(text);
            Policy policy = parseDocument(root);
            span.setAttribute("ruleCount", policy.rules().size());
            logger.debug("Parsed policy version {} with {} rules", policy.version(), policy.rules().size());
            return policy;
        } catch (PolicyParseException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private JsonNode readTree(String text) {
        if (text == null || text.isBlank()) {
            throw new PolicyParseException("Policy document is empty", DOCUMENT, null, "mapping");
        }
        try {
            JsonNode root = yamlMapper.readTree(text);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new PolicyParseException("Policy document is empty", DOCUMENT, null, "mapping");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new PolicyParseException("Malformed policy document: " + e.getOriginalMessage(), e);
        } catch (NumberFormatException e) {
            throw new PolicyParseException("Malformed number in policy document: " + e.getMessage(), e);
        }
    }

    private Policy parseDocument(JsonNode root) {
        if (!root.isObject()) {
            throw new PolicyParseException(
                    "Policy document must be a mapping, got " + describe(root), DOCUMENT, null, "mapping");
        }
        rejectUnknownKeys(root, DOCUMENT_KEYS, DOCUMENT, "document");

        String version = Policy.DEFAULT_VERSION;
        JsonNode versionNode = root.get("version");
        if (versionNode != null && !versionNode.isNull()) {
            if (!versionNode.isTextual() && !versionNode.isNumber()) {
                throw typeError(DOCUMENT, "version", "string", versionNode);
            }
            version = versionNode.asText();
        }

        JsonNode policiesNode = root.get("policies");
        if (policiesNode == null || policiesNode.isNull()) {
            throw new PolicyParseException("Missing required key 'policies'", DOCUMENT, "policies", "sequence");
        }
        if (!policiesNode.isArray()) {
            throw typeError(DOCUMENT, "policies", "sequence", policiesNode);
        }

        List<Rule> rules = new ArrayList<>(policiesNode.size());
        for (int i = 0; i < policiesNode.size(); i++) {
            rules.add(parseRule(policiesNode.get(i), i));
        }

        Policy.Pricing pricing = parsePricing(root.get("pricing"));
        Policy.Audit audit = parseAudit(root.get("audit"));
        return new Policy(version, rules, pricing, audit);
    }

    /**
     * Parses a single rule mapping. {@code index} is its position in the {@code policies} list and
     * determines the default rule id.
     */
    public Rule parseRule(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new PolicyParseException(
                    "Rule " + index + " must be a mapping, got " + describe(node), index, null, "mapping");
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || typeNode.isNull()) {
            throw new PolicyParseException("Rule " + index + " is missing 'type'", index, "type", "string");
        }
        if (!typeNode.isTextual()) {
            throw typeError(index, "type", "string", typeNode);
        }
        RuleType type = RuleType.fromTag(typeNode.asText())
                .orElseThrow(() -> new PolicyParseException(
                        "Rule " + index + " has unknown type '" + typeNode.asText() + "', expected one of "
                                + RuleType.tags(),
                        index, "type", String.join("|", RuleType.tags())));

        String ruleId = parseRuleId(node, type, index);
        switch (type) {
            case ALLOWLIST:
                rejectUnknownKeys(node, LIST_RULE_KEYS, index, type.tag());
                return new Rule.Allowlist(ruleId, requireField(node, index), requireValues(node, index));
            case DENYLIST:
                rejectUnknownKeys(node, LIST_RULE_KEYS, index, type.tag());
                return new Rule.Denylist(ruleId, requireField(node, index), requireValues(node, index));
            case RATE_LIMIT:
                rejectUnknownKeys(node, RATE_LIMIT_KEYS, index, type.tag());
                return new Rule.RateLimit(ruleId,
                        requireLong(node, "max_requests", index),
                        requireLong(node, "window_seconds", index));
            case SPENDING_CAP:
                rejectUnknownKeys(node, SPENDING_CAP_KEYS, index, type.tag());
                return new Rule.SpendingCap(ruleId,
                        requireDecimal(node, "max_amount", index),
                        requireString(node, "currency", index),
                        requireLong(node, "window_seconds", index));
            default:
                throw new IllegalStateException("Unhandled rule type: " + type);
        }
    }

    private String parseRuleId(JsonNode node, RuleType type, int index) {
        JsonNode idNode = node.get("id");
        if (idNode == null || idNode.isNull()) {
            return Rule.defaultId(type, index);
        }
        if (!idNode.isTextual() || idNode.asText().isBlank()) {
            throw typeError(index, "id", "non-empty string", idNode);
        }
        return idNode.asText();
    }

    private SubjectField requireField(JsonNode node, int index) {
        String key = requireString(node, "field", index);
        return SubjectField.fromKey(key)
                .orElseThrow(() -> new PolicyParseException(
                        "Rule " + index + " has unknown field '" + key + "', expected one of " + SubjectField.keys(),
                        index, "field", String.join("|", SubjectField.keys())));
    }

    private List<String> requireValues(JsonNode node, int index) {
        JsonNode valuesNode = require(node, "values", index, "sequence of strings");
        if (!valuesNode.isArray()) {
            throw typeError(index, "values", "sequence of strings", valuesNode);
        }
        List<String> values = new ArrayList<>(valuesNode.size());
        for (JsonNode value : valuesNode) {
            if (!value.isTextual()) {
                throw typeError(index, "values", "sequence of strings", value);
            }
            values.add(value.asText());
        }
        return values;
    }

    private long requireLong(JsonNode node, String key, int index) {
        JsonNode value = require(node, key, index, "integer");
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw typeError(index, key, "integer", value);
        }
        return value.longValue();
    }

    private BigDecimal requireDecimal(JsonNode node, String key, int index) {
        return boundedDecimal(require(node, key, index, "number"), index, key);
    }

    private static BigDecimal boundedDecimal(JsonNode value, int index, String field) {
        if (!value.isNumber()) {
            throw typeError(index, field, "number", value);
        }
        BigDecimal amount = value.decimalValue().stripTrailingZeros();
        long integerDigits = (long) amount.precision() - amount.scale();
        if (integerDigits > MAX_AMOUNT_DIGITS || amount.scale() > MAX_AMOUNT_DIGITS) {
            throw new PolicyParseException(
                    location(index) + ": '" + field + "' is out of range, got " + describe(value)
                            + " (at most " + MAX_AMOUNT_DIGITS + " integer and " + MAX_AMOUNT_DIGITS
                            + " fractional digits)",
                    index, field, "number");
        }
        return amount;
    }

    private String requireString(JsonNode node, String key, int index) {
        JsonNode value = require(node, key, index, "string");
        if (!value.isTextual()) {
            throw typeError(index, key, "string", value);
        }
        return value.asText();
    }

    private JsonNode require(JsonNode node, String key, int index, String expectedType) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            throw new PolicyParseException(
                    location(index) + " is missing required key '" + key + "'", index, key, expectedType);
        }
        return value;
    }

    private Policy.Pricing parsePricing(JsonNode node) {
        if (node == null || node.isNull()) {
            return Policy.Pricing.DEFAULT;
        }
        if (!node.isObject()) {
            throw typeError(DOCUMENT, "pricing", "mapping", node);
        }
        rejectUnknownKeys(node, PRICING_KEYS, DOCUMENT, "pricing");
        BigDecimal amount = Policy.Pricing.DEFAULT.amount();
        JsonNode amountNode = node.get("amount");
        if (amountNode != null) {
            amount = boundedDecimal(amountNode, DOCUMENT, "pricing.amount");
        }
        String currency = optionalString(node, "currency", "pricing.currency", Policy.Pricing.DEFAULT.currency());
        String memoPrefix = optionalString(node, "memo_prefix", "pricing.memo_prefix", null);
        return new Policy.Pricing(amount, currency, memoPrefix);
    }

    private Policy.Audit parseAudit(JsonNode node) {
        if (node == null || node.isNull()) {
            return Policy.Audit.DEFAULT;
        }
        if (!node.isObject()) {
            throw typeError(DOCUMENT, "audit", "mapping", node);
        }
        rejectUnknownKeys(node, AUDIT_KEYS, DOCUMENT, "audit");
        boolean enabled = Policy.Audit.DEFAULT.enabled();
        JsonNode enabledNode = node.get("enabled");
        if (enabledNode != null) {
            if (!enabledNode.isBoolean()) {
                throw typeError(DOCUMENT, "audit.enabled", "boolean", enabledNode);
            }
            enabled = enabledNode.booleanValue();
        }
        String format = optionalString(node, "format", "audit.format", Policy.Audit.DEFAULT.format());
        String destination = optionalString(node, "destination", "audit.destination",
                Policy.Audit.DEFAULT.destination());
        return new Policy.Audit(enabled, format, destination);
    }

    private String optionalString(JsonNode node, String key, String qualifiedName, String defaultValue) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual()) {
            throw typeError(DOCUMENT, qualifiedName, "string", value);
        }
        return value.asText();
    }

    private void rejectUnknownKeys(JsonNode node, Set<String> allowed, int index, String context) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw new PolicyParseException(
                        location(index) + " has unknown key '" + name + "' for " + context,
                        index, name, null);
            }
        }
    }

    private static PolicyParseException typeError(int index, String field, String expected, JsonNode actual) {
        return new PolicyParseException(
                location(index) + ": '" + field + "' must be " + article(expected) + expected
                        + ", got " + describe(actual),
                index, field, expected);
    }

    private static String location(int index) {
        return index == DOCUMENT ? "Policy document" : "Rule " + index;
    }

    private static String article(String expected) {
        return "aeiou".indexOf(expected.charAt(0)) >= 0 ? "an " : "a ";
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        if (node.isTextual()) {
            return "string \"" + node.asText() + "\"";
        }
        if (node.isNumber()) {
            return "number " + node.asText();
        }
        return node.getNodeType().name().toLowerCase();
    }
}
