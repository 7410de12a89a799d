/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics;

/**
 * Monotonically increasing counter.
 * Thread-safe.
 */
public interface Counter {
    void increment();

    void increment(long amount);

    long count();
}
