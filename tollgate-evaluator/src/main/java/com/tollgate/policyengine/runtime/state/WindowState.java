/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.state;

import com.tollgate.policyengine.api.exceptions.InternalEngineException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutable per-key window guarded by its own lock.
 *
 * <p>If a critical section fails with an unexpected runtime exception the window may be half
 * updated, so it is marked poisoned and every later access fails with
 * {@link InternalEngineException} instead of enforcing against corrupt data.
 */
public abstract sealed class WindowState permits RateWindowState, SpendingWindowState {

    private final StateKey key;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean poisoned;

    WindowState(StateKey key) {
        this.key = key;
    }

    public StateKey key() {
        return key;
    }

    public boolean isPoisoned() {
        return poisoned;
    }

    final <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            if (poisoned) {
                throw new InternalEngineException("State for " + key + " is poisoned by an earlier failure");
            }
            try {
                return action.get();
            } catch (RuntimeException e) {
                poisoned = true;
                throw new InternalEngineException("Failed to update state for " + key, e);
            }
        } finally {
            lock.unlock();
        }
    }
}
