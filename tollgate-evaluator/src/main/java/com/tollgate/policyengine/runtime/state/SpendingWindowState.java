/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.state;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed window of accumulated spend for one spending cap and subject.
 *
 * <p>The window starts at the first commit after it expired; it has expired once more than
 * {@code window} has passed since its start.
 */
public final class SpendingWindowState extends WindowState {

    private BigDecimal accumulated = BigDecimal.ZERO;
    private Instant windowStart;

    SpendingWindowState(StateKey key) {
        super(key);
    }

    public BigDecimal currentSpend(Instant now, long windowSeconds) {
        return withLock(() -> isExpired(now, windowSeconds) ? BigDecimal.ZERO : accumulated);
    }

    public void add(Instant now, long windowSeconds, BigDecimal amount) {
        withLock(() -> {
            if (isExpired(now, windowSeconds)) {
                windowStart = now;
                accumulated = BigDecimal.ZERO;
            }
            accumulated = accumulated.add(amount);
            return null;
        });
    }

    public Snapshot snapshot() {
        return withLock(() -> new Snapshot(accumulated, windowStart));
    }

    private boolean isExpired(Instant now, long windowSeconds) {
        return windowStart == null
                || Duration.between(windowStart, now).compareTo(Duration.ofSeconds(windowSeconds)) > 0;
    }

    public record Snapshot(BigDecimal accumulated, Instant windowStart) {
    }
}
