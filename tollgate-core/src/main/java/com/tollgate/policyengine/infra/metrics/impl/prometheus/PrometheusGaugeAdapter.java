/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.prometheus;

import com.tollgate.policyengine.infra.metrics.Gauge;

/**
 * Bridges {@link Gauge} to one labelled child of a Prometheus gauge. Last write wins.
 */
final class PrometheusGaugeAdapter implements Gauge {

    private final io.prometheus.client.Gauge.Child gauge;

    PrometheusGaugeAdapter(io.prometheus.client.Gauge gauge, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.gauge = gauge.labels(labelValues);
    }

    @Override
    public void set(double value) {
        gauge.set(value);
    }

    @Override
    public double value() {
        return gauge.get();
    }
}
