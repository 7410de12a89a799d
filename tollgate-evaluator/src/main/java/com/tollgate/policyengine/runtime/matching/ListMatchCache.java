/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.runtime.matching;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.infra.config.EngineConfig;

/**
 * Hands out one {@link SubjectListMatcher} per policy instance.
 *
 * <p>Policies are held weakly and compared by identity, so a matcher lives as long as its
 * policy is in use and a reloaded policy never sees results computed for the old one.
 */
public final class ListMatchCache {

    private static final int MAX_TRACKED_POLICIES = 16;

    private final long cacheSize;
    private final boolean recordStats;
    private final Cache<ValidatedPolicy, SubjectListMatcher> matchers = Caffeine.newBuilder()
            .weakKeys()
            .maximumSize(MAX_TRACKED_POLICIES)
            .build();

    public ListMatchCache(EngineConfig config) {
        this.cacheSize = config.getMatchCacheSize();
        this.recordStats = config.isRecordMatchCacheStats();
    }

    public SubjectListMatcher matcherFor(ValidatedPolicy policy) {
        return matchers.get(policy, p -> new SubjectListMatcher(p, cacheSize, recordStats));
    }
}
