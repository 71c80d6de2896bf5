/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

public enum ImprovementPriority {
    LOW,
    MEDIUM,
    HIGH
}
