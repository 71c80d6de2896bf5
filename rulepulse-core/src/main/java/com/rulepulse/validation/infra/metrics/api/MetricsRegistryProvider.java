/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics.api;

import com.rulepulse.validation.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must have a public no-arg constructor and be registered in
 * {@code META-INF/services/com.rulepulse.validation.infra.metrics.api.MetricsRegistryProvider}.
 * When several providers are present the one with the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
