/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.state;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Sliding log of committed request instants for one rate limit and subject.
 *
 * <p>An instant counts while it is at or after {@code now - window}. Reads never prune;
 * {@link #record} prunes before appending.
 */
public final class RateWindowState extends WindowState {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Deque<Instant> instants = new ArrayDeque<>();

    RateWindowState(StateKey key) {
        super(key);
    }

    /**
     * Seconds until one more request would fit, or 0 if it fits now.
     * A non-zero result is never below 1.
     */
    public long retryAfterSeconds(Instant now, long maxRequests, long windowSeconds) {
        Duration window = Duration.ofSeconds(windowSeconds);
        Instant cutoff = now.minus(window);
        return withLock(() -> {
            long count = 0;
            Instant oldest = null;
            for (Instant instant : instants) {
                if (!instant.isBefore(cutoff)) {
                    count++;
                    if (oldest == null || instant.isBefore(oldest)) {
                        oldest = instant;
                    }
                }
            }
            if (count < maxRequests) {
                return 0L;
            }
            long nanos = Duration.between(now, oldest.plus(window)).toNanos();
            long seconds = (nanos + NANOS_PER_SECOND - 1) / NANOS_PER_SECOND;
            return Math.max(1L, seconds);
        });
    }

    public void record(Instant now, long windowSeconds) {
        Instant cutoff = now.minusSeconds(windowSeconds);
        withLock(() -> {
            instants.removeIf(instant -> instant.isBefore(cutoff));
            instants.addLast(now);
            return null;
        });
    }

    public List<Instant> snapshot() {
        return withLock(() -> List.copyOf(instants));
    }
}
