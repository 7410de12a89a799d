/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler;

import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.SubjectField;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyParserTest {

    private PolicyParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new PolicyParser(OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Should parse every rule type from YAML")
    void shouldParseAllRuleTypes() {
        String yaml = """
                version: "1.0"
                policies:
                  - type: allowlist
                    field: agent_id
                    values: ["agent-*", "partner"]
                  - type: denylist
                    id: blocked-wallets
                    field: wallet_address
                    values: ["0xdead"]
                  - type: rate_limit
                    max_requests: 100
                    window_seconds: 60
                  - type: spending_cap
                    max_amount: 10.50
                    currency: USDC
                    window_seconds: 86400
                """;

        Policy policy = parser.parse(yaml);

        assertThat(policy.version()).isEqualTo("1.0");
        assertThat(policy.rules()).hasSize(4);
        assertThat(policy.rules().get(0)).isEqualTo(
                new Rule.Allowlist("allowlist-0", SubjectField.AGENT_ID, java.util.List.of("agent-*", "partner")));
        assertThat(policy.rules().get(1).ruleId()).isEqualTo("blocked-wallets");
        assertThat(policy.rules().get(2)).isEqualTo(new Rule.RateLimit("rate_limit-2", 100, 60));
        Rule.SpendingCap cap = (Rule.SpendingCap) policy.rules().get(3);
        assertThat(cap.maxAmount()).isEqualByComparingTo("10.5");
        assertThat(cap.currency()).isEqualTo("USDC");
        assertThat(cap.windowSeconds()).isEqualTo(86400);
    }

    @Test
    @DisplayName("Should accept JSON input and apply section defaults")
    void shouldParseJsonWithDefaults() {
        Policy policy = parser.parse("""
                {"policies": [{"type": "rate_limit", "max_requests": 5, "window_seconds": 1}]}
                """);

        assertThat(policy.version()).isEqualTo(Policy.DEFAULT_VERSION);
        assertThat(policy.pricing().amount()).isEqualByComparingTo("0.01");
        assertThat(policy.pricing().currency()).isEqualTo("USDC");
        assertThat(policy.audit().enabled()).isTrue();
        assertThat(policy.audit().format()).isEqualTo("json");
    }

    @Test
    void shouldParsePricingAndAuditSections() {
        Policy policy = parser.parse("""
                policies:
                  - type: rate_limit
                    max_requests: 5
                    window_seconds: 1
                pricing:
                  amount: 0.05
                  currency: USDC
                  memo_prefix: api
                audit:
                  enabled: false
                  format: csv
                  destination: audit.log
                """);

        assertThat(policy.pricing()).isEqualTo(new Policy.Pricing(new BigDecimal("0.05"), "USDC", "api"));
        assertThat(policy.audit()).isEqualTo(new Policy.Audit(false, "csv", "audit.log"));
    }

    @Test
    void shouldParseFromFile() throws IOException {
        Path file = tempDir.resolve("policy.yaml");
        Files.writeString(file, """
                policies:
                  - type: denylist
                    field: ip_address
                    values: ["10.0.0.*"]
                """);

        Policy policy = parser.parse(file);

        assertThat(policy.rules()).singleElement().isInstanceOf(Rule.Denylist.class);
    }

    @Test
    @DisplayName("Should reject numeric fields given as strings")
    void shouldRejectQuotedNumber() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: rate_limit
                    max_requests: "10"
                    window_seconds: 60
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("max_requests")
                .satisfies(e -> {
                    PolicyParseException pe = (PolicyParseException) e;
                    assertThat(pe.getRuleIndex()).isZero();
                    assertThat(pe.getField()).isEqualTo("max_requests");
                    assertThat(pe.getExpectedType()).isEqualTo("integer");
                });
    }

    @Test
    void shouldRejectFractionalInteger() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: rate_limit
                    max_requests: 10
                    window_seconds: 1.5
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("window_seconds");
    }

    @Test
    void shouldRejectUnknownRuleType() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: rate_limit
                    max_requests: 10
                    window_seconds: 60
                  - type: geo_block
                    countries: [XX]
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("unknown type 'geo_block'")
                .extracting(e -> ((PolicyParseException) e).getRuleIndex())
                .isEqualTo(1);
    }

    @Test
    void shouldRejectUnknownKeyInRule() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: allowlist
                    field: agent_id
                    values: [a]
                    priority: 3
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("unknown key 'priority'");
    }

    @Test
    void shouldRejectUnknownSubjectField() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: allowlist
                    field: endpoint
                    values: ["/api/*"]
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("unknown field 'endpoint'");
    }

    @Test
    void shouldRejectNonStringValues() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: denylist
                    field: agent_id
                    values: [1, 2]
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("values");
    }

    @Test
    void shouldRejectMissingPolicies() {
        assertThatThrownBy(() -> parser.parse("version: \"1.0\"\n"))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("policies")
                .extracting(e -> ((PolicyParseException) e).isDocumentLevel())
                .isEqualTo(true);
    }

    @Test
    void shouldRejectEmptyAndMalformedDocuments() {
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> parser.parse("policies: [unclosed"))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> parser.parse("- just\n- a list\n"))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    void shouldRejectMissingRequiredKey() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: spending_cap
                    max_amount: 10
                    window_seconds: 60
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("missing required key 'currency'");
    }

    @Test
    @DisplayName("Should reject amounts whose exponent cannot be represented")
    void shouldRejectOutOfRangeAmount() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: spending_cap
                    max_amount: 1e999999999
                    currency: USDC
                    window_seconds: 60
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("'max_amount' is out of range")
                .satisfies(e -> {
                    PolicyParseException pe = (PolicyParseException) e;
                    assertThat(pe.getRuleIndex()).isZero();
                    assertThat(pe.getField()).isEqualTo("max_amount");
                    assertThat(pe.getExpectedType()).isEqualTo("number");
                });
    }

    @Test
    void shouldRejectOutOfRangePricingAmount() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: rate_limit
                    max_requests: 10
                    window_seconds: 60
                pricing:
                  amount: 1e-999999999
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("'pricing.amount' is out of range")
                .extracting(e -> ((PolicyParseException) e).isDocumentLevel())
                .isEqualTo(true);
    }

    @Test
    void shouldKeepLargeAmountsWithinRange() {
        Policy policy = parser.parse("""
                policies:
                  - type: spending_cap
                    max_amount: 1e30
                    currency: USDC
                    window_seconds: 60
                """);

        assertThat(policy.rules()).singleElement()
                .isInstanceOfSatisfying(Rule.SpendingCap.class,
                        cap -> assertThat(cap.maxAmount()).isEqualByComparingTo(new BigDecimal("1e30")));
    }

    @Test
    @DisplayName("Should reject a key repeated within one mapping")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> parser.parse("""
                policies:
                  - type: rate_limit
                    max_requests: "x"
                    max_requests: 5
                    window_seconds: 60
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("Duplicate field 'max_requests'");
        assertThatThrownBy(() -> parser.parse("""
                policies: []
                policies:
                  - type: rate_limit
                    max_requests: 5
                    window_seconds: 60
                """))
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("Duplicate field 'policies'");
    }

    @Test
    void emptyPolicyListParses() {
        assertThat(parser.parse("policies: []\n").rules()).isEmpty();
    }
}
