/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.internal;

import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import com.tollgate.policyengine.infra.metrics.api.MetricsRegistryProvider;
import com.tollgate.policyengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.tollgate.policyengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider;
import com.tollgate.policyengine.infra.metrics.impl.prometheus.PrometheusMetricsRegistryProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryHolderTest {

    @Test
    void highestPriorityProviderWins() {
        List<MetricsRegistryProvider> providers = List.of(
                new PrometheusMetricsRegistryProvider(), new InMemoryMetricsRegistryProvider());

        assertThat(MetricsRegistryHolder.create(providers)).isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    void fallsBackToNoOp() {
        MetricsRegistry registry = MetricsRegistryHolder.create(List.of());

        registry.counter("anything").increment();

        assertThat(registry).isSameAs(NoOpMetricsRegistry.INSTANCE);
        assertThat(registry.counter("anything").count()).isZero();
        assertThat(registry.timer("t").time(() -> "x")).isEqualTo("x");
    }
}
