/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics.impl.inmemory;

import com.rulepulse.validation.infra.metrics.MetricsRegistry;
import com.rulepulse.validation.infra.metrics.api.MetricsRegistryProvider;

/**
 * Provider for {@link InMemoryMetricsRegistry}. Registered for the test class path only.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
