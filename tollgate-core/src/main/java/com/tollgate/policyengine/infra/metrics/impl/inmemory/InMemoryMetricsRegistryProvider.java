/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.inmemory;

import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import com.tollgate.policyengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for testing.
 *
 * <p>Register it in {@code src/test/resources/META-INF/services} to take precedence over the
 * Prometheus provider during tests.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
