/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.config;

import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Thresholds that turn a rule's counters into an effectiveness status.
 *
 * <p><b>Environment Variable Override:</b> every threshold can be overridden with
 * {@code RULEPULSE_<PROPERTY_NAME>}:
 * <pre>
 * RULEPULSE_MIN_VALIDATIONS=20
 * RULEPULSE_MIN_FEEDBACK=5
 * RULEPULSE_EFFECTIVE_RATIO=0.75
 * RULEPULSE_MIXED_FEEDBACK_FLOOR=0.4
 * RULEPULSE_INEFFECTIVE_RATIO=0.6
 * RULEPULSE_INCONSISTENCY_BAND=0.2
 * </pre>
 *
 * <p>The same keys are accepted from a {@link Properties} source in lower-case dotted form,
 * e.g. {@code rulepulse.min.validations=20}.
 */
public final class EffectivenessPolicy {

    private static final Logger logger = Logger.getLogger(EffectivenessPolicy.class.getName());

    static final String ENV_PREFIX = "RULEPULSE_";

    static final String MIN_VALIDATIONS = "MIN_VALIDATIONS";
    static final String MIN_FEEDBACK = "MIN_FEEDBACK";
    static final String EFFECTIVE_RATIO = "EFFECTIVE_RATIO";
    static final String MIXED_FEEDBACK_FLOOR = "MIXED_FEEDBACK_FLOOR";
    static final String INEFFECTIVE_RATIO = "INEFFECTIVE_RATIO";
    static final String INCONSISTENCY_BAND = "INCONSISTENCY_BAND";

    private static final EffectivenessPolicy DEFAULTS = builder().build();

    private final int minValidations;
    private final int minFeedback;
    private final double effectiveRatio;
    private final double mixedFeedbackFloor;
    private final double ineffectiveRatio;
    private final double inconsistencyBand;

    private EffectivenessPolicy(Builder builder) {
        this.minValidations = builder.minValidations;
        this.minFeedback = builder.minFeedback;
        this.effectiveRatio = builder.effectiveRatio;
        this.mixedFeedbackFloor = builder.mixedFeedbackFloor;
        this.ineffectiveRatio = builder.ineffectiveRatio;
        this.inconsistencyBand = builder.inconsistencyBand;
        validate();
    }

    public static EffectivenessPolicy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EffectivenessPolicy fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds a policy from {@code RULEPULSE_*} variables in the given map. Unparseable values
     * are logged and ignored.
     */
    public static EffectivenessPolicy fromEnvironment(Map<String, String> env) {
        return builder().apply(key -> env.get(ENV_PREFIX + key)).build();
    }

    public static EffectivenessPolicy fromProperties(Properties properties) {
        return builder()
                .apply(key -> properties.getProperty(propertyKey(key)))
                .build();
    }

    static String propertyKey(String key) {
        return "rulepulse." + key.toLowerCase().replace('_', '.');
    }

    public int minValidations() {
        return minValidations;
    }

    public int minFeedback() {
        return minFeedback;
    }

    public double effectiveRatio() {
        return effectiveRatio;
    }

    public double mixedFeedbackFloor() {
        return mixedFeedbackFloor;
    }

    public double ineffectiveRatio() {
        return ineffectiveRatio;
    }

    public double inconsistencyBand() {
        return inconsistencyBand;
    }

    private void validate() {
        if (minValidations < 0) {
            throw new IllegalArgumentException("minValidations must not be negative: " + minValidations);
        }
        if (minFeedback < 0) {
            throw new IllegalArgumentException("minFeedback must not be negative: " + minFeedback);
        }
        requireRatio("effectiveRatio", effectiveRatio);
        requireRatio("mixedFeedbackFloor", mixedFeedbackFloor);
        requireRatio("ineffectiveRatio", ineffectiveRatio);
        requireRatio("inconsistencyBand", inconsistencyBand);
        if (mixedFeedbackFloor > effectiveRatio) {
            throw new IllegalArgumentException("mixedFeedbackFloor must be <= effectiveRatio: "
                    + mixedFeedbackFloor + " > " + effectiveRatio);
        }
    }

    private static void requireRatio(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be between 0 and 1: " + value);
        }
    }

    @Override
    public String toString() {
        return "EffectivenessPolicy{minValidations=" + minValidations
                + ", minFeedback=" + minFeedback
                + ", effectiveRatio=" + effectiveRatio
                + ", mixedFeedbackFloor=" + mixedFeedbackFloor
                + ", ineffectiveRatio=" + ineffectiveRatio
                + ", inconsistencyBand=" + inconsistencyBand + '}';
    }

    public static final class Builder {
        private int minValidations = 10;
        private int minFeedback = 5;
        private double effectiveRatio = 0.7;
        private double mixedFeedbackFloor = 0.4;
        private double ineffectiveRatio = 0.6;
        private double inconsistencyBand = 0.2;

        private Builder() {
        }

        public Builder minValidations(int minValidations) {
            this.minValidations = minValidations;
            return this;
        }

        public Builder minFeedback(int minFeedback) {
            this.minFeedback = minFeedback;
            return this;
        }

        public Builder effectiveRatio(double effectiveRatio) {
            this.effectiveRatio = effectiveRatio;
            return this;
        }

        public Builder mixedFeedbackFloor(double mixedFeedbackFloor) {
            this.mixedFeedbackFloor = mixedFeedbackFloor;
            return this;
        }

        public Builder ineffectiveRatio(double ineffectiveRatio) {
            this.ineffectiveRatio = ineffectiveRatio;
            return this;
        }

        public Builder inconsistencyBand(double inconsistencyBand) {
            this.inconsistencyBand = inconsistencyBand;
            return this;
        }

        Builder apply(Function<String, String> source) {
            readInt(source, MIN_VALIDATIONS).ifPresent(val -> this.minValidations = val);
            readInt(source, MIN_FEEDBACK).ifPresent(val -> this.minFeedback = val);
            readDouble(source, EFFECTIVE_RATIO).ifPresent(val -> this.effectiveRatio = val);
            readDouble(source, MIXED_FEEDBACK_FLOOR).ifPresent(val -> this.mixedFeedbackFloor = val);
            readDouble(source, INEFFECTIVE_RATIO).ifPresent(val -> this.ineffectiveRatio = val);
            readDouble(source, INCONSISTENCY_BAND).ifPresent(val -> this.inconsistencyBand = val);
            return this;
        }

        public EffectivenessPolicy build() {
            return new EffectivenessPolicy(this);
        }

        private static Optional<String> read(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded policy override: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> readInt(Function<String, String> source, String key) {
            return read(source, key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Double> readDouble(Function<String, String> source, String key) {
            return read(source, key).map(val -> {
                try {
                    return Double.parseDouble(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid double value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
