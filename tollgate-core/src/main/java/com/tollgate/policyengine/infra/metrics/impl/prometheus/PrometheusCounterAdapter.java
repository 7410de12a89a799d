/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.prometheus;

import com.tollgate.policyengine.infra.metrics.Counter;

/**
 * Bridges {@link Counter} to one labelled child of a Prometheus counter.
 *
 * <pre>{@code
 * io.prometheus.client.Counter decisions = Counter.build()
 *     .name("tollgate_decisions_total").labelNames("outcome").register();
 *
 * Counter denies = new PrometheusCounterAdapter(decisions, new String[]{"deny"});
 * denies.increment();   // tollgate_decisions_total{outcome="deny"}
 * }</pre>
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child counter;

    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.counter = counter.labels(labelValues);
    }

    @Override
    public void increment() {
        counter.inc();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        counter.inc(amount);
    }

    @Override
    public long count() {
        return (long) counter.get();
    }
}
