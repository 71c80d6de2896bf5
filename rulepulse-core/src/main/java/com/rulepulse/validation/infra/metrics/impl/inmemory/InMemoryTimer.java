/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.metrics.impl.inmemory;

import com.rulepulse.validation.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every recorded duration; percentiles use linear interpolation between ranks.
 */
final class InMemoryTimer implements Timer {

    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public Duration percentile(double percentile) {
        List<Duration> sorted = sortedRecordings();
        if (sorted.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));
        double index = (sorted.size() - 1) * p;
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted.get(lower);
        }
        long lowerNanos = sorted.get(lower).toNanos();
        long upperNanos = sorted.get(upper).toNanos();
        return Duration.ofNanos(lowerNanos + (long) ((upperNanos - lowerNanos) * (index - lower)));
    }

    List<Duration> recordings() {
        return List.copyOf(recordings);
    }

    private List<Duration> sortedRecordings() {
        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);
        return sorted;
    }
}
