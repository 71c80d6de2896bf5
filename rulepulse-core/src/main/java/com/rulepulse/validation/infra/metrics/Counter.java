/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics;

/**
 * Monotonically increasing counter. Thread-safe.
 */
public interface Counter {
    void increment();
    void increment(long amount);
    long count();
}
