/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

/**
 * Scoring objective used when searching a rule's parameter space.
 */
public enum OptimizationStrategy {
    /** Reward candidates that lower the projected failure rate. */
    MINIMIZE_FAILURES,
    /** Reward candidates that raise the projected pass rate, preferring small moves. */
    MAXIMIZE_PASS_RATE,
    /** Reward candidates that lower the projected average severity of failures. */
    BALANCE_SEVERITY,
    /** Reward candidates that shift the projected feedback ratio toward positive. */
    OPTIMIZE_FEEDBACK
}
