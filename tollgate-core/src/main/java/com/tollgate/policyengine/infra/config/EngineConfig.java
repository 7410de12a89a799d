/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;

/**
 * Runtime settings for the engine.
 *
 * <p>Values are resolved in three layers, later layers winning:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@value #PROPERTIES_RESOURCE} on the classpath</li>
 *   <li>environment variables</li>
 * </ol>
 *
 * <p>Environment variables:
 * <pre>
 * TOLLGATE_MATCH_CACHE_SIZE=10000        # 0 disables list-match memoization
 * TOLLGATE_MATCH_CACHE_RECORD_STATS=true
 * TOLLGATE_RELOAD_INTERVAL_SECONDS=10
 * </pre>
 *
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .matchCacheSize(50_000)
 *     .reloadIntervalSeconds(5)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String PROPERTIES_RESOURCE = "tollgate.properties";

    static final String ENV_MATCH_CACHE_SIZE = "TOLLGATE_MATCH_CACHE_SIZE";
    static final String ENV_MATCH_CACHE_RECORD_STATS = "TOLLGATE_MATCH_CACHE_RECORD_STATS";
    static final String ENV_RELOAD_INTERVAL_SECONDS = "TOLLGATE_RELOAD_INTERVAL_SECONDS";

    static final String PROP_MATCH_CACHE_SIZE = "tollgate.match-cache.size";
    static final String PROP_MATCH_CACHE_RECORD_STATS = "tollgate.match-cache.record-stats";
    static final String PROP_RELOAD_INTERVAL_SECONDS = "tollgate.reload.interval-seconds";

    private final long matchCacheSize;
    private final boolean recordMatchCacheStats;
    private final long reloadIntervalSeconds;

    private EngineConfig(Builder builder) {
        this.matchCacheSize = builder.matchCacheSize;
        this.recordMatchCacheStats = builder.recordMatchCacheStats;
        this.reloadIntervalSeconds = builder.reloadIntervalSeconds;
        validate();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults, overlaid with {@value #PROPERTIES_RESOURCE} if present, overlaid with the environment.
     */
    public static EngineConfig load() {
        return load(loadClasspathProperties(), System::getenv);
    }

    static EngineConfig load(Properties properties, Function<String, String> env) {
        Builder builder = builder();
        builder.applyProperties(properties);
        builder.applyEnvironment(env);
        EngineConfig config = builder.build();
        logger.debug("Loaded engine configuration: {}", config);
        return config;
    }

    public static EngineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        builder.applyProperties(properties);
        return builder.build();
    }

    private static Properties loadClasspathProperties() {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EngineConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults", PROPERTIES_RESOURCE, e);
        }
        return properties;
    }

    private void validate() {
        if (matchCacheSize < 0) {
            throw new IllegalArgumentException("matchCacheSize must be >= 0, got " + matchCacheSize);
        }
        if (reloadIntervalSeconds < 1) {
            throw new IllegalArgumentException("reloadIntervalSeconds must be >= 1, got " + reloadIntervalSeconds);
        }
    }

    public long getMatchCacheSize() {
        return matchCacheSize;
    }

    public boolean isMatchCacheEnabled() {
        return matchCacheSize > 0;
    }

    public boolean isRecordMatchCacheStats() {
        return recordMatchCacheStats;
    }

    public long getReloadIntervalSeconds() {
        return reloadIntervalSeconds;
    }

    public Builder toBuilder() {
        return builder()
                .matchCacheSize(matchCacheSize)
                .recordMatchCacheStats(recordMatchCacheStats)
                .reloadIntervalSeconds(reloadIntervalSeconds);
    }

    @Override
    public String toString() {
        return "EngineConfig{matchCacheSize=" + matchCacheSize
                + ", recordMatchCacheStats=" + recordMatchCacheStats
                + ", reloadIntervalSeconds=" + reloadIntervalSeconds + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long matchCacheSize = 10_000;
        private boolean recordMatchCacheStats = false;
        private long reloadIntervalSeconds = 10;

        private Builder() {
        }

        public Builder matchCacheSize(long matchCacheSize) {
            this.matchCacheSize = matchCacheSize;
            return this;
        }

        public Builder recordMatchCacheStats(boolean recordMatchCacheStats) {
            this.recordMatchCacheStats = recordMatchCacheStats;
            return this;
        }

        public Builder reloadIntervalSeconds(long reloadIntervalSeconds) {
            this.reloadIntervalSeconds = reloadIntervalSeconds;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        void applyProperties(Properties properties) {
            apply(properties::getProperty,
                    PROP_MATCH_CACHE_SIZE, PROP_MATCH_CACHE_RECORD_STATS, PROP_RELOAD_INTERVAL_SECONDS);
        }

        void applyEnvironment(Function<String, String> env) {
            apply(env, ENV_MATCH_CACHE_SIZE, ENV_MATCH_CACHE_RECORD_STATS, ENV_RELOAD_INTERVAL_SECONDS);
        }

        private void apply(Function<String, String> source, String sizeKey, String statsKey, String intervalKey) {
            Long size = getLong(source, sizeKey);
            if (size != null) {
                matchCacheSize = size;
            }
            String stats = trimmed(source.apply(statsKey));
            if (stats != null) {
                recordMatchCacheStats = Boolean.parseBoolean(stats);
            }
            Long interval = getLong(source, intervalKey);
            if (interval != null) {
                reloadIntervalSeconds = interval;
            }
        }

        private static Long getLong(Function<String, String> source, String key) {
            String value = trimmed(source.apply(key));
            if (value == null) {
                return null;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid value '{}' for {}", value, key);
                return null;
            }
        }

        private static String trimmed(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
