/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.runtime.effectiveness;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantLock} per rule id.
 *
 * <p>Values are weakly held: a lock that no thread references can be collected, and the
 * next request for that id creates a fresh one. A thread holding a lock keeps it strongly
 * reachable, so all contenders for an id share the same instance.
 */
public final class RuleLockRegistry {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(ruleId -> new ReentrantLock());

    public ReentrantLock lockFor(String ruleId) {
        return locks.get(ruleId);
    }

    public <T> T withLock(String ruleId, Supplier<T> action) {
        ReentrantLock lock = locks.get(ruleId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
