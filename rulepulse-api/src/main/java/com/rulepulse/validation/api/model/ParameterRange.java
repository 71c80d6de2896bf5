/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import java.io.Serializable;

/**
 * Search interval for one numeric parameter. {@code minValue <= maxValue} always holds.
 */
public record ParameterRange(
        String name,
        double minValue,
        double maxValue,
        double step,
        double currentValue
) implements Serializable {

    public ParameterRange {
        if (minValue > maxValue) {
            double swap = minValue;
            minValue = maxValue;
            maxValue = swap;
        }
        step = Math.abs(step);
    }

    public boolean isSearchable() {
        return step > 0 && Double.isFinite(step) && Double.isFinite(minValue)
                && Double.isFinite(maxValue) && Double.isFinite(currentValue);
    }
}
