/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics;

/**
 * Last-written value metric. Thread-safe.
 */
public interface Gauge {
    void set(double value);
    double value();
}
