/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.internal;

import com.tollgate.policyengine.infra.metrics.Counter;
import com.tollgate.policyengine.infra.metrics.Gauge;
import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import com.tollgate.policyengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Fallback used when no provider is configured.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private static final Counter COUNTER = new Counter() {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    };

    private static final Gauge GAUGE = new Gauge() {
        public void set(double value) {}
        public double value() { return 0.0; }
    };

    private static final Timer TIMER = new Timer() {
        public void record(Duration duration) {}
        public long count() { return 0L; }
        public <T> T time(Supplier<T> operation) { return operation.get(); }
    };

    private NoOpMetricsRegistry() {
    }

    @Override
    public Counter counter(String name, String... tags) {
        return COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return TIMER;
    }
}
