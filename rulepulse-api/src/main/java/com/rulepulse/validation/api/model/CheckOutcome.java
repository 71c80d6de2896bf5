/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import java.io.Serializable;

/**
 * Result of a single {@link com.rulepulse.validation.api.RuleCheck} invocation.
 */
public record CheckOutcome(boolean passed, String message) implements Serializable {

    public CheckOutcome {
        if (message == null) message = "";
    }

    public static CheckOutcome pass() {
        return new CheckOutcome(true, "");
    }

    public static CheckOutcome pass(String message) {
        return new CheckOutcome(true, message);
    }

    public static CheckOutcome fail(String message) {
        return new CheckOutcome(false, message);
    }
}
