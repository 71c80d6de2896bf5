/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.persistence;

import com.rulepulse.validation.api.model.EffectivenessStatus;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.api.model.ValidationCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class JsonFileRecordStoreTest {

    @TempDir
    Path tempDir;

    private JsonFileRecordStore<RuleEffectiveness> store;

    @BeforeEach
    void setUp() {
        store = new JsonFileRecordStore<>(tempDir.resolve("effectiveness"), RuleEffectiveness.class);
    }

    private static RuleEffectiveness record(String ruleId) {
        return new RuleEffectiveness(ruleId, "Name of " + ruleId, ValidationCategory.POWER,
                12, 9, 3, 6, 5, 1, 1.5, EffectivenessStatus.EFFECTIVE,
                Instant.parse("2025-02-03T04:05:06Z"));
    }

    @Test
    @DisplayName("Should read back exactly what was saved")
    void shouldReadBackSavedRecord() {
        store.save("decoupling-caps", record("decoupling-caps"));

        assertThat(store.load("decoupling-caps")).contains(record("decoupling-caps"));
        assertThat(store.load("absent")).isEmpty();
    }

    @Test
    @DisplayName("Should write snake_case JSON with ISO instants")
    void shouldWriteSnakeCaseJson() throws IOException {
        store.save("r1", record("r1"));

        String json = Files.readString(store.fileFor("r1"));

        assertThat(json).contains("\"rule_id\"", "\"total_validations\"", "\"average_severity\"",
                "\"2025-02-03T04:05:06Z\"");
    }

    @Test
    @DisplayName("Should encode keys that are not safe file names")
    void shouldEncodeUnsafeKeys() {
        store.save("audio/ground loop", record("audio/ground loop"));

        assertThat(store.fileFor("audio/ground loop").getParent()).isEqualTo(store.directory());
        assertThat(store.loadAll()).containsOnlyKeys("audio/ground loop");
    }

    @Test
    @DisplayName("Should replace an existing record without leaving temporary files")
    void shouldReplaceAtomically() throws IOException {
        store.save("r1", record("r1"));
        RuleEffectiveness updated = record("r1").withStatus(EffectivenessStatus.INEFFECTIVE);

        store.save("r1", updated);

        assertThat(store.load("r1")).contains(updated);
        try (Stream<Path> files = Files.list(store.directory())) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should skip unreadable files when loading everything")
    void shouldSkipCorruptFiles() throws IOException {
        store.save("good", record("good"));
        Files.writeString(store.directory().resolve("broken.json"), "{not json");

        assertThat(store.loadAll()).containsOnlyKeys("good");
        assertThatThrownBy(() -> store.load("broken")).isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @DisplayName("Should delete single records and clear the directory")
    void shouldDeleteAndClear() {
        store.save("a", record("a"));
        store.save("b", record("b"));

        assertThat(store.delete("a")).isTrue();
        assertThat(store.delete("a")).isFalse();
        store.clear();

        assertThat(store.loadAll()).isEmpty();
    }
}
