/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ValidationEngineConfigTest {

    @Test
    @DisplayName("Should default to file persistence with a bounded history")
    void shouldUseDefaults() {
        ValidationEngineConfig config = ValidationEngineConfig.defaults();

        assertThat(config.persistenceMode()).isEqualTo(ValidationEngineConfig.PersistenceMode.FILE);
        assertThat(config.maxHistoryPerRule()).isEqualTo(100);
        assertThat(config.effectivenessDir()).isEqualTo(Path.of("rulepulse-data", "effectiveness"));
        assertThat(config.historyDir()).isEqualTo(Path.of("rulepulse-data", "optimization-history"));
        assertThat(config.policy().minValidations()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should read overrides from environment variables")
    void shouldReadEnvironment() {
        Map<String, String> env = Map.of(
                "RULEPULSE_PERSISTENCE", "memory",
                "RULEPULSE_DATA_DIR", "/tmp/rules",
                "RULEPULSE_MAX_HISTORY_PER_RULE", "25",
                "RULEPULSE_MIN_VALIDATIONS", "20");

        ValidationEngineConfig config = ValidationEngineConfig.fromEnvironment(env);

        assertThat(config.persistenceMode()).isEqualTo(ValidationEngineConfig.PersistenceMode.MEMORY);
        assertThat(config.dataDir()).isEqualTo(Path.of("/tmp/rules"));
        assertThat(config.maxHistoryPerRule()).isEqualTo(25);
        assertThat(config.policy().minValidations()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should ignore unparseable overrides")
    void shouldIgnoreInvalidValues() {
        Map<String, String> env = Map.of(
                "RULEPULSE_PERSISTENCE", "cloud",
                "RULEPULSE_MAX_HISTORY_PER_RULE", "many",
                "RULEPULSE_DATA_DIR", "  ");

        ValidationEngineConfig config = ValidationEngineConfig.fromEnvironment(env);

        assertThat(config.persistenceMode()).isEqualTo(ValidationEngineConfig.PersistenceMode.FILE);
        assertThat(config.maxHistoryPerRule()).isEqualTo(100);
        assertThat(config.dataDir()).isEqualTo(Path.of("rulepulse-data"));
    }

    @Test
    @DisplayName("Should read dotted property keys")
    void shouldReadProperties() {
        Properties properties = new Properties();
        properties.setProperty("rulepulse.persistence", "MEMORY");
        properties.setProperty("rulepulse.max.history.per.rule", "0");
        properties.setProperty("rulepulse.effective.ratio", "0.8");

        ValidationEngineConfig config = ValidationEngineConfig.fromProperties(properties);

        assertThat(config.persistenceMode()).isEqualTo(ValidationEngineConfig.PersistenceMode.MEMORY);
        assertThat(config.maxHistoryPerRule()).isZero();
        assertThat(config.policy().effectiveRatio()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Should reject a negative history bound")
    void shouldRejectNegativeHistory() {
        assertThatThrownBy(() -> ValidationEngineConfig.builder().maxHistoryPerRule(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
