/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics;

/**
 * Instantaneous value metric.
 * Thread-safe.
 */
public interface Gauge {
    void set(double value);

    double value();
}
