/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics;

import com.tollgate.policyengine.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; see
 * {@link com.tollgate.policyengine.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <p>Tags are passed as alternating key/value strings. The same name with different tag values
 * yields independent series:
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("tollgate_decisions_total", "outcome", "deny").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags alternating label names and values
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Process-wide registry. Falls back to a no-op registry when no provider is installed.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
