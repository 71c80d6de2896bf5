/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics.internal;

import com.rulepulse.validation.infra.metrics.MetricsRegistry;
import com.rulepulse.validation.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry NO_OP = new NoOpMetricsRegistry();
    public static final MetricsRegistry INSTANCE = discover();

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry discover() {
        ServiceLoader<MetricsRegistryProvider> loader =
                ServiceLoader.load(MetricsRegistryProvider.class);

        MetricsRegistryProvider provider = StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider == null) {
            logger.fine("No metrics provider found, using no-op implementation");
            return NO_OP;
        }
        logger.log(Level.INFO, "Using metrics provider: {0} (priority: {1})",
                new Object[]{provider.name(), provider.priority()});
        return provider.create();
    }
}
