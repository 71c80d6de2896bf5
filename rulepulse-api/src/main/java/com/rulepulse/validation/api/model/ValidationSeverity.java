/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

/**
 * Severity attached to a rule and to each failed validation.
 *
 * <p>The numeric {@link #level()} is what the effectiveness tracker folds into a rule's
 * running average severity, so the ordering of the constants is significant.
 */
public enum ValidationSeverity {
    INFO(0),
    WARNING(1),
    ERROR(2),
    CRITICAL(3);

    private final int level;

    ValidationSeverity(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Highest numeric level, used to normalise severity-based scores to 0..1.
     */
    public static int maxLevel() {
        return CRITICAL.level;
    }

    public boolean isAtLeast(ValidationSeverity other) {
        return level >= other.level;
    }
}
