/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics.impl.inmemory;

import com.rulepulse.validation.infra.metrics.Counter;
import com.rulepulse.validation.infra.metrics.Gauge;
import com.rulepulse.validation.infra.metrics.MetricsRegistry;
import com.rulepulse.validation.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics registry that keeps every series in memory.
 *
 * <p>Series are keyed by name plus tags, so {@code counter("x", "rule", "a")} and
 * {@code counter("x", "rule", "b")} are distinct. The read helpers take the same arguments:
 * <pre>{@code
 * registry.counter("rule_validations_total", "outcome", "failed").increment();
 * assertThat(registry.counterValue("rule_validations_total", "outcome", "failed")).isEqualTo(1L);
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

    public long counterValue(String name, String... tags) {
        Counter counter = counters.get(seriesKey(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double gaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(seriesKey(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> timerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(seriesKey(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    static String seriesKey(String name, String... tags) {
        if (tags == null || tags.length == 0) {
            return name;
        }
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs: " + tags.length + " values given");
        }
        StringBuilder key = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) {
                key.append(',');
            }
            key.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return key.append('}').toString();
    }
}
