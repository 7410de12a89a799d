/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Latency recorder.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     *
     * @throws IllegalArgumentException if the duration is negative
     */
    void record(Duration duration);

    /**
     * Number of recorded observations.
     */
    long count();

    /**
     * Runs {@code operation} and records how long it took, including when it throws.
     */
    default <T> T time(Supplier<T> operation) {
        long start = System.nanoTime();
        try {
            return operation.get();
        } finally {
            record(Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
