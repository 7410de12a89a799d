/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.matching;

import com.tollgate.policyengine.api.model.SubjectField;
import com.tollgate.policyengine.compiler.PolicyCompiler;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.infra.config.EngineConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubjectListMatcherTest {

    private static final ValidatedPolicy POLICY = new PolicyCompiler().compile("""
            policies:
              - type: allowlist
                id: api-clients
                field: agent_id
                values: ["/api/*", "/api/admin/*", "/api/admin/root"]
              - type: denylist
                id: blocked-ips
                field: ip_address
                values: ["10.0.*"]
              - type: denylist
                id: blocked-host
                field: ip_address
                values: ["10.0.0.1"]
            """);

    @Test
    void picksMostSpecificAllowPattern() {
        SubjectListMatcher matcher = new SubjectListMatcher(POLICY, 0, false);

        assertThat(matcher.match(SubjectField.AGENT_ID, "/api/admin/users").authoritativePattern())
                .isEqualTo("/api/admin/*");
        assertThat(matcher.match(SubjectField.AGENT_ID, "/api/users").authoritativePattern())
                .isEqualTo("/api/*");
        assertThat(matcher.match(SubjectField.AGENT_ID, "/api/admin/root").authoritativePattern())
                .isEqualTo("/api/admin/root");

        ListMatch rejected = matcher.match(SubjectField.AGENT_ID, "/web/home");
        assertThat(rejected.isRejectedByAllowlist()).isTrue();
        assertThat(matcher.allowlistRuleId(SubjectField.AGENT_ID)).contains("api-clients");
    }

    @Test
    void reportsFirstMatchingDenyRuleInPolicyOrder() {
        SubjectListMatcher matcher = new SubjectListMatcher(POLICY, 0, false);

        ListMatch match = matcher.match(SubjectField.IP_ADDRESS, "10.0.0.1");

        assertThat(match.isDenied()).isTrue();
        assertThat(match.denyRuleId()).isEqualTo("blocked-ips");
        assertThat(match.denyRuleOrder()).isEqualTo(1);
        assertThat(match.allowlistApplies()).isFalse();
        assertThat(matcher.match(SubjectField.IP_ADDRESS, "192.168.0.1").isDenied()).isFalse();
    }

    @Test
    void memoizesMatchesWhenCacheEnabled() {
        SubjectListMatcher matcher = new SubjectListMatcher(POLICY, 100, true);

        ListMatch first = matcher.match(SubjectField.AGENT_ID, "/api/x");
        ListMatch second = matcher.match(SubjectField.AGENT_ID, "/api/x");

        assertThat(second).isSameAs(first);
        assertThat(matcher.cacheStats()).hasValueSatisfying(stats -> assertThat(stats.hitCount()).isEqualTo(1));
        assertThat(new SubjectListMatcher(POLICY, 0, true).cacheStats()).isEmpty();
    }

    @Test
    void cacheKeepsOneMatcherPerPolicyInstance() {
        ListMatchCache cache = new ListMatchCache(EngineConfig.defaults());
        ValidatedPolicy equalButDistinct = new PolicyCompiler().compile("""
                policies:
                  - type: allowlist
                    id: api-clients
                    field: agent_id
                    values: ["/api/*", "/api/admin/*", "/api/admin/root"]
                  - type: denylist
                    id: blocked-ips
                    field: ip_address
                    values: ["10.0.*"]
                  - type: denylist
                    id: blocked-host
                    field: ip_address
                    values: ["10.0.0.1"]
                """);

        assertThat(cache.matcherFor(POLICY)).isSameAs(cache.matcherFor(POLICY));
        assertThat(cache.matcherFor(equalButDistinct)).isNotSameAs(cache.matcherFor(POLICY));
    }
}
