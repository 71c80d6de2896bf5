/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.persistence;

import java.util.Map;
import java.util.Optional;

/**
 * Keyed store for one kind of persisted record (one record per rule id).
 *
 * <p>Implementations must be thread-safe. I/O failures surface as
 * {@link java.io.UncheckedIOException}; callers decide whether to absorb them.
 *
 * @param <T> the record type
 */
public interface RecordStore<T> {

    Optional<T> load(String key);

    /**
     * Loads every stored record. Unreadable entries are skipped and logged.
     */
    Map<String, T> loadAll();

    void save(String key, T record);

    boolean delete(String key);

    void clear();
}
