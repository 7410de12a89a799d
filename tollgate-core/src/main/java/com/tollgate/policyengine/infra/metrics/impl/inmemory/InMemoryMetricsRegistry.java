/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.metrics.impl.inmemory;

import com.tollgate.policyengine.infra.metrics.Counter;
import com.tollgate.policyengine.infra.metrics.Gauge;
import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import com.tollgate.policyengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics registry that keeps everything in memory, for tests and embedded use.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * evaluator = new PolicyEvaluator(config, metrics);
 * ...
 * assertThat(metrics.getCounterValue("tollgate_decisions_total", "outcome", "deny")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(seriesKey(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(seriesKey(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(seriesKey(name, tags), k -> new InMemoryTimer());
    }

    public long getCounterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(seriesKey(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        InMemoryGauge gauge = gauges.get(seriesKey(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(seriesKey(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    static String seriesKey(String name, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs, got " + tags.length + " elements");
        }
        if (tags.length == 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) sb.append(',');
            sb.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return sb.append('}').toString();
    }
}
