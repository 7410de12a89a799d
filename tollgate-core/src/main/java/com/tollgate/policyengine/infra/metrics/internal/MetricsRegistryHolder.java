/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.internal;

import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import com.tollgate.policyengine.infra.metrics.api.MetricsRegistryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistryHolder.class);

    public static final MetricsRegistry INSTANCE = create(ServiceLoader.load(MetricsRegistryProvider.class));

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry create(Iterable<MetricsRegistryProvider> providers) {
        Optional<MetricsRegistryProvider> selected = StreamSupport.stream(providers.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority));

        if (selected.isPresent()) {
            MetricsRegistryProvider provider = selected.get();
            logger.info("Using metrics provider {} (priority {})", provider.name(), provider.priority());
            return provider.create();
        }
        logger.info("No metrics provider found, metrics are disabled");
        return NoOpMetricsRegistry.INSTANCE;
    }
}
