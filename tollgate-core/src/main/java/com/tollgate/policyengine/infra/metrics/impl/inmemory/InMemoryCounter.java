/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.inmemory;

import com.tollgate.policyengine.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {
    private final LongAdder value = new LongAdder();

    @Override
    public void increment() {
        value.increment();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        value.add(amount);
    }

    @Override
    public long count() {
        return value.sum();
    }
}
