/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

/**
 * Functional area a validation rule belongs to.
 */
public enum ValidationCategory {
    DESIGN,
    SAFETY,
    MANUFACTURING,
    POWER,
    AUDIO,
    SIGNAL_INTEGRITY,
    GROUND,
    THERMAL,
    EMI,
    COMPONENTS,
    GENERAL
}
