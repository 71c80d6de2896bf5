/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.exceptions;

/**
 * Root of the engine's exception hierarchy.
 *
 * <p>Unchecked, so registry and feedback errors surface to callers without forcing
 * checked-exception plumbing through every orchestration layer.
 */
public class RulePulseException extends RuntimeException {

    public RulePulseException(String message) {
        super(message);
    }

    public RulePulseException(String message, Throwable cause) {
        super(message, cause);
    }
}
