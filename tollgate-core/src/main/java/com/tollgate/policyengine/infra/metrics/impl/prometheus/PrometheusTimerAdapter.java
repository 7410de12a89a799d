/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.prometheus;

import com.tollgate.policyengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bridges {@link Timer} to a Prometheus histogram.
 *
 * <p>Durations are recorded in seconds, the Prometheus base unit. Percentiles are left to the
 * server ({@code histogram_quantile}); the client only keeps bucket counts and the sum.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public <T> T time(Supplier<T> operation) {
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return operation.get();
        } finally {
            timer.observeDuration();
        }
    }

    /**
     * Observation count, read from the cumulative {@code +Inf} bucket.
     */
    @Override
    public long count() {
        double[] buckets = histogram.get().buckets;
        return buckets.length == 0 ? 0L : (long) buckets[buckets.length - 1];
    }

    /**
     * Sum of all observations in seconds.
     */
    double sum() {
        return histogram.get().sum;
    }
}
