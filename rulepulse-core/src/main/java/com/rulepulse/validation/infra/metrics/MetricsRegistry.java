/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics;

import com.rulepulse.validation.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}; when no
 * provider is on the class path a no-op registry is used.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("rule_validations_total", "rule", ruleId, "outcome", "failed").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs, flattened as {@code k1, v1, k2, v2}
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NO_OP;
    }
}
