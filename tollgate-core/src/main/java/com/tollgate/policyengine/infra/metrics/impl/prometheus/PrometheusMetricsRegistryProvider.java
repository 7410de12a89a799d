/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.prometheus;

import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import com.tollgate.policyengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed metrics provider, registered through {@code META-INF/services}.
 * Series land in {@link io.prometheus.client.CollectorRegistry#defaultRegistry}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
