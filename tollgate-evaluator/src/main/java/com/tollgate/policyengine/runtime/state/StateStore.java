/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rate and spending windows of one enforcement point, keyed by rule and subject.
 *
 * <p>Entries are created on first commit and never removed. Lookups are lock-free; each
 * window serializes its own updates, so different keys never contend.
 *
 * <p>Rule ids are only unique within one policy. If a reload reuses an id for a rule of the
 * other kind, the stale window is ignored on read and replaced on the next commit.
 */
public final class StateStore {
    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    private final ConcurrentMap<StateKey, WindowState> states = new ConcurrentHashMap<>();

    public Optional<RateWindowState> findRateWindow(StateKey key) {
        WindowState state = states.get(key);
        return state instanceof RateWindowState rate ? Optional.of(rate) : Optional.empty();
    }

    public Optional<SpendingWindowState> findSpendingWindow(StateKey key) {
        WindowState state = states.get(key);
        return state instanceof SpendingWindowState spending ? Optional.of(spending) : Optional.empty();
    }

    public RateWindowState rateWindowFor(StateKey key) {
        WindowState state = states.compute(key, (k, existing) -> {
            if (existing instanceof RateWindowState) {
                return existing;
            }
            logReplacement(k, existing);
            return new RateWindowState(k);
        });
        return (RateWindowState) state;
    }

    public SpendingWindowState spendingWindowFor(StateKey key) {
        WindowState state = states.compute(key, (k, existing) -> {
            if (existing instanceof SpendingWindowState) {
                return existing;
            }
            logReplacement(k, existing);
            return new SpendingWindowState(k);
        });
        return (SpendingWindowState) state;
    }

    public int size() {
        return states.size();
    }

    public Set<StateKey> keys() {
        return Set.copyOf(states.keySet());
    }

    private static void logReplacement(StateKey key, WindowState existing) {
        if (existing != null) {
            logger.warn("Replacing {} for {}: rule id now names a different kind of rule",
                    existing.getClass().getSimpleName(), key);
        }
    }
}
