/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api;

import com.rulepulse.validation.api.model.RuleMetricsSnapshot;

/**
 * Receiver for per-rule metrics pushed after every tracked validation.
 */
@FunctionalInterface
public interface CommunityMetricsSink {

    void publish(RuleMetricsSnapshot snapshot);

    static CommunityMetricsSink noop() {
        return snapshot -> { };
    }
}
