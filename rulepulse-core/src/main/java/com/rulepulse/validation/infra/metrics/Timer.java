/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency recorder. Thread-safe.
 */
public interface Timer {

    /**
     * Times execution of the callable.
     *
     * @return the callable's result
     * @throws Exception whatever the callable throws
     */
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * @param percentile value between 0.0 and 1.0
     */
    Duration percentile(double percentile);
}
