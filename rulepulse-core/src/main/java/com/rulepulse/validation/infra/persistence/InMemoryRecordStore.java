/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.persistence;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store, used when persistence is disabled and in tests.
 */
public final class InMemoryRecordStore<T> implements RecordStore<T> {

    private final Map<String, T> records = new ConcurrentHashMap<>();

    @Override
    public Optional<T> load(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public Map<String, T> loadAll() {
        return new LinkedHashMap<>(records);
    }

    @Override
    public void save(String key, T record) {
        records.put(key, record);
    }

    @Override
    public boolean delete(String key) {
        return records.remove(key) != null;
    }

    @Override
    public void clear() {
        records.clear();
    }

    public int size() {
        return records.size();
    }
}
