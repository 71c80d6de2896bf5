/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.runtime.effectiveness;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.*;

class RuleLockRegistryTest {

    private final RuleLockRegistry registry = new RuleLockRegistry();

    @Test
    @DisplayName("Should hand out one lock per rule id while it is referenced")
    void shouldShareLockPerRule() {
        ReentrantLock first = registry.lockFor("r1");

        assertThat(registry.lockFor("r1")).isSameAs(first);
        assertThat(registry.lockFor("r2")).isNotSameAs(first);
    }

    @Test
    @DisplayName("Should hold the rule lock while the action runs")
    void shouldHoldLockDuringAction() {
        ReentrantLock lock = registry.lockFor("r1");

        boolean heldInside = registry.withLock("r1", lock::isHeldByCurrentThread);

        assertThat(heldInside).isTrue();
        assertThat(lock.isHeldByCurrentThread()).isFalse();
    }
}
