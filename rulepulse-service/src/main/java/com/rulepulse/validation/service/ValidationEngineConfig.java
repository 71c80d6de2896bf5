/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.service;

import com.rulepulse.validation.infra.config.EffectivenessPolicy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings for a {@link ValidationManager} built through {@link ValidationManager#create}.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * RULEPULSE_PERSISTENCE=file|memory
 * RULEPULSE_DATA_DIR=/var/lib/rulepulse
 * RULEPULSE_MAX_HISTORY_PER_RULE=100
 * </pre>
 * plus every {@link EffectivenessPolicy} threshold.
 */
public final class ValidationEngineConfig {

    private static final Logger logger = Logger.getLogger(ValidationEngineConfig.class.getName());

    public enum PersistenceMode {
        /** One JSON file per rule under {@link #dataDir()}. */
        FILE,
        /** Nothing survives the process. */
        MEMORY
    }

    static final String PERSISTENCE = "RULEPULSE_PERSISTENCE";
    static final String DATA_DIR = "RULEPULSE_DATA_DIR";
    static final String MAX_HISTORY_PER_RULE = "RULEPULSE_MAX_HISTORY_PER_RULE";

    static final String EFFECTIVENESS_DIR = "effectiveness";
    static final String HISTORY_DIR = "optimization-history";

    private final PersistenceMode persistenceMode;
    private final Path dataDir;
    private final int maxHistoryPerRule;
    private final EffectivenessPolicy policy;

    private ValidationEngineConfig(Builder builder) {
        this.persistenceMode = builder.persistenceMode;
        this.dataDir = builder.dataDir;
        this.maxHistoryPerRule = builder.maxHistoryPerRule;
        this.policy = builder.policy;
        if (maxHistoryPerRule < 0) {
            throw new IllegalArgumentException("maxHistoryPerRule must not be negative: " + maxHistoryPerRule);
        }
    }

    public static ValidationEngineConfig defaults() {
        return builder().build();
    }

    public static ValidationEngineConfig inMemory() {
        return builder().persistenceMode(PersistenceMode.MEMORY).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ValidationEngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ValidationEngineConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder().policy(EffectivenessPolicy.fromEnvironment(env));

        String mode = trimmed(env.get(PERSISTENCE));
        if (mode != null) {
            try {
                builder.persistenceMode(PersistenceMode.valueOf(mode.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid persistence mode for " + PERSISTENCE + ": " + mode);
            }
        }

        String dir = trimmed(env.get(DATA_DIR));
        if (dir != null) {
            builder.dataDir(Path.of(dir));
        }

        String maxHistory = trimmed(env.get(MAX_HISTORY_PER_RULE));
        if (maxHistory != null) {
            try {
                builder.maxHistoryPerRule(Integer.parseInt(maxHistory));
            } catch (NumberFormatException e) {
                logger.warning("Invalid int value for " + MAX_HISTORY_PER_RULE + ": " + maxHistory);
            }
        }
        return builder.build();
    }

    /**
     * Same keys as {@link #fromEnvironment(Map)} in lower-case dotted form, e.g.
     * {@code rulepulse.data.dir}.
     */
    public static ValidationEngineConfig fromProperties(Properties properties) {
        Map<String, String> env = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            env.put(name.toUpperCase(Locale.ROOT).replace('.', '_'), properties.getProperty(name));
        }
        return fromEnvironment(env);
    }

    public PersistenceMode persistenceMode() {
        return persistenceMode;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path effectivenessDir() {
        return dataDir.resolve(EFFECTIVENESS_DIR);
    }

    public Path historyDir() {
        return dataDir.resolve(HISTORY_DIR);
    }

    /**
     * @return optimization results kept per rule; 0 keeps everything
     */
    public int maxHistoryPerRule() {
        return maxHistoryPerRule;
    }

    public EffectivenessPolicy policy() {
        return policy;
    }

    private static String trimmed(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return "ValidationEngineConfig{persistenceMode=" + persistenceMode
                + ", dataDir=" + dataDir
                + ", maxHistoryPerRule=" + maxHistoryPerRule
                + ", policy=" + policy + '}';
    }

    public static final class Builder {
        private PersistenceMode persistenceMode = PersistenceMode.FILE;
        private Path dataDir = Path.of("rulepulse-data");
        private int maxHistoryPerRule = 100;
        private EffectivenessPolicy policy = EffectivenessPolicy.defaults();

        private Builder() {
        }

        public Builder persistenceMode(PersistenceMode persistenceMode) {
            this.persistenceMode = Objects.requireNonNull(persistenceMode, "persistenceMode must not be null");
            return this;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
            return this;
        }

        public Builder maxHistoryPerRule(int maxHistoryPerRule) {
            this.maxHistoryPerRule = maxHistoryPerRule;
            return this;
        }

        public Builder policy(EffectivenessPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public ValidationEngineConfig build() {
            return new ValidationEngineConfig(this);
        }
    }
}
