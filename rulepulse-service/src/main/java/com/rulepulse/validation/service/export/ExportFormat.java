/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.service.export;

import java.util.Locale;

public enum ExportFormat {
    CSV,
    JSON;

    public static ExportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Export format must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + value, e);
        }
    }
}
