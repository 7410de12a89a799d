/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.inmemory;

import com.tollgate.policyengine.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }
}
