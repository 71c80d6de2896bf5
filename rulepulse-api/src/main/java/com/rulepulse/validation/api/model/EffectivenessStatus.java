/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

/**
 * Real-world usefulness of a rule, derived purely from its recorded counters.
 */
public enum EffectivenessStatus {
    /** Not enough validations or feedback to judge. */
    UNKNOWN,
    EFFECTIVE,
    INEFFECTIVE,
    NEEDS_IMPROVEMENT
}
