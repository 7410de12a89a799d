/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.api;

import com.tollgate.policyengine.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must have a public no-arg constructor, be thread-safe and be listed in
 * {@code META-INF/services/com.tollgate.policyengine.infra.metrics.api.MetricsRegistryProvider}.
 * When several providers are present, the one with the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /**
     * Higher values are preferred when multiple providers exist.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
