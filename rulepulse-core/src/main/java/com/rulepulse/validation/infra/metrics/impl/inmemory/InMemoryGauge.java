/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics.impl.inmemory;

import com.rulepulse.validation.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {

    private volatile double value;

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }
}
