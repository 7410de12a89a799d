/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.state;

import com.tollgate.policyengine.api.exceptions.InternalEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final StateKey KEY = new StateKey("rate_limit-0", "agent_id=a");

    private final StateStore store = new StateStore();

    @Test
    void entriesAreCreatedOnlyOnCommitPath() {
        assertThat(store.findRateWindow(KEY)).isEmpty();
        assertThat(store.size()).isZero();

        RateWindowState window = store.rateWindowFor(KEY);

        assertThat(store.rateWindowFor(KEY)).isSameAs(window);
        assertThat(store.findRateWindow(KEY)).containsSame(window);
        assertThat(store.keys()).containsExactly(KEY);
    }

    @Test
    @DisplayName("Should treat a window of the other kind as absent and replace it on commit")
    void mismatchedKindIsReplaced() {
        store.rateWindowFor(KEY).record(T0, 60);

        assertThat(store.findSpendingWindow(KEY)).isEmpty();

        SpendingWindowState spending = store.spendingWindowFor(KEY);
        assertThat(store.findRateWindow(KEY)).isEmpty();
        assertThat(store.findSpendingWindow(KEY)).containsSame(spending);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void rateWindowCountsInstantsInsideWindowInclusive() {
        RateWindowState window = store.rateWindowFor(KEY);
        window.record(T0, 60);
        window.record(T0.plusSeconds(1), 60);

        assertThat(window.retryAfterSeconds(T0.plusSeconds(2), 3, 60)).isZero();
        assertThat(window.retryAfterSeconds(T0.plusSeconds(2), 2, 60)).isEqualTo(58);
        // oldest instant sits exactly on the cutoff
        assertThat(window.retryAfterSeconds(T0.plusSeconds(60), 2, 60)).isEqualTo(1);
        assertThat(window.retryAfterSeconds(T0.plusSeconds(61), 2, 60)).isZero();
    }

    @Test
    void retryAfterRoundsUp() {
        RateWindowState window = store.rateWindowFor(KEY);
        window.record(T0, 10);

        assertThat(window.retryAfterSeconds(T0.plusMillis(2_500), 1, 10)).isEqualTo(8);
    }

    @Test
    void recordPrunesExpiredInstants() {
        RateWindowState window = store.rateWindowFor(KEY);
        window.record(T0, 60);
        window.record(T0.plusSeconds(30), 60);
        window.record(T0.plusSeconds(61), 60);

        assertThat(window.snapshot()).containsExactly(T0.plusSeconds(30), T0.plusSeconds(61));
    }

    @Test
    void readsDoNotPrune() {
        RateWindowState window = store.rateWindowFor(KEY);
        window.record(T0, 60);

        window.retryAfterSeconds(T0.plusSeconds(3600), 1, 60);

        assertThat(window.snapshot()).containsExactly(T0);
    }

    @Test
    void spendingWindowResetsAfterExpiry() {
        SpendingWindowState window = store.spendingWindowFor(new StateKey("cap", "anonymous"));
        window.add(T0, 60, new BigDecimal("4"));
        window.add(T0.plusSeconds(60), 60, new BigDecimal("3"));

        assertThat(window.currentSpend(T0.plusSeconds(60), 60)).isEqualByComparingTo("7");
        assertThat(window.currentSpend(T0.plusSeconds(61), 60)).isEqualByComparingTo("0");

        window.add(T0.plusSeconds(61), 60, new BigDecimal("2"));

        assertThat(window.snapshot().accumulated()).isEqualByComparingTo("2");
        assertThat(window.snapshot().windowStart()).isEqualTo(T0.plusSeconds(61));
    }

    @Test
    @DisplayName("Should poison a window after a failed critical section")
    void failedUpdatePoisonsWindow() {
        RateWindowState window = store.rateWindowFor(KEY);

        assertThatThrownBy(() -> window.withLock(() -> {
            throw new IllegalStateException("corrupted");
        })).isInstanceOf(InternalEngineException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(window.isPoisoned()).isTrue();
        assertThatThrownBy(() -> window.retryAfterSeconds(T0, 1, 60))
                .isInstanceOf(InternalEngineException.class)
                .hasMessageContaining("poisoned");
        assertThatThrownBy(() -> window.record(T0, 60)).isInstanceOf(InternalEngineException.class);
    }

    @Test
    void concurrentCommitsAreAllRecorded() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        StateKey capKey = new StateKey("cap", "agent_id=a");
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.rateWindowFor(KEY).record(T0, 60);
                        store.spendingWindowFor(capKey).add(T0, 60, new BigDecimal("0.01"));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.rateWindowFor(KEY).snapshot()).hasSize(threads * perThread);
        assertThat(store.spendingWindowFor(capKey).currentSpend(T0, 60)).isEqualByComparingTo("20.00");
        assertThat(store.size()).isEqualTo(2);
    }
}
