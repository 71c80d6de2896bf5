/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics;

import com.rulepulse.validation.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class InMemoryMetricsRegistryTest {

    private final InMemoryMetricsRegistry registry = new InMemoryMetricsRegistry();

    @Test
    @DisplayName("Should keep tagged series apart")
    void shouldKeepTaggedSeriesApart() {
        registry.counter("events", "kind", "a").increment();
        registry.counter("events", "kind", "a").increment(2);
        registry.counter("events", "kind", "b").increment();

        assertThat(registry.counterValue("events", "kind", "a")).isEqualTo(3);
        assertThat(registry.counterValue("events", "kind", "b")).isEqualTo(1);
        assertThat(registry.counterValue("events")).isZero();
    }

    @Test
    @DisplayName("Should reject odd tag arrays")
    void shouldRejectOddTags() {
        assertThatThrownBy(() -> registry.gauge("g", "lonely"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should interpolate timer percentiles")
    void shouldInterpolatePercentiles() throws Exception {
        Timer timer = registry.timer("latency");
        timer.record(Duration.ofMillis(10));
        timer.record(Duration.ofMillis(30));
        timer.record(Duration.ofMillis(20));

        assertThat(timer.percentile(0.5)).isEqualTo(Duration.ofMillis(20));
        assertThat(timer.percentile(0.25)).isEqualTo(Duration.ofMillis(15));
        assertThat(timer.record(() -> "done")).isEqualTo("done");
        assertThat(registry.timerRecordings("latency")).hasSize(4);
    }

    @Test
    @DisplayName("Should discover the in-memory provider registered on the test class path")
    void shouldDiscoverProvider() {
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(InMemoryMetricsRegistry.class);
        assertThat(MetricsRegistry.noop().counter("x").count()).isZero();
    }
}
