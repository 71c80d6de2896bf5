/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.optimizer.optimization;

import com.rulepulse.validation.api.model.ParameterRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class ParameterRangeTableTest {

    private final ParameterRangeTable table = ParameterRangeTable.defaults();

    @ParameterizedTest(name = "{0}={1} -> [{2}, {3}] step {4}")
    @CsvSource({
            "threshold,           1000, 500,  1500, 100",
            "noise_threshold,     10,   5,    15,   1",
            "min_value,           100,  0,    200,  10",
            "max_value,           2000, 1000, 4000, 200",
            "tolerance,           100,  0,    200,  5",
            "impedance_tolerance, 10,   0,    20,   0.5"
    })
    @DisplayName("Should derive ranges from the parameter name")
    void shouldDeriveRanges(String name, double value, double min, double max, double step) {
        ParameterRange range = table.rangeFor(name, value).orElseThrow();

        assertThat(range.name()).isEqualTo(name);
        assertThat(range.currentValue()).isEqualTo(value);
        assertThat(range.minValue()).isCloseTo(min, within(1e-9));
        assertThat(range.maxValue()).isCloseTo(max, within(1e-9));
        assertThat(range.step()).isCloseTo(step, within(1e-9));
    }

    @Test
    @DisplayName("Should have no range for unrecognised names")
    void shouldIgnoreUnknownNames() {
        assertThat(table.rangeFor("spacing", 5)).isEmpty();
        assertThat(table.rangeFor("thresholds_enabled", 1)).isEmpty();
        assertThat(table.rangeFor(null, 1)).isEmpty();
    }

    @Test
    @DisplayName("Should apply the first matching entry")
    void shouldApplyFirstMatch() {
        assertThat(table.heuristicFor("min_threshold"))
                .map(ParameterRangeTable.RangeHeuristic::label)
                .contains("threshold");
        assertThat(table.heuristicFor("min_tolerance"))
                .map(ParameterRangeTable.RangeHeuristic::loosening)
                .contains(ParameterRangeTable.Loosening.DECREASE);
    }

    @Test
    @DisplayName("Should match names case-insensitively")
    void shouldMatchCaseInsensitively() {
        assertThat(table.rangeFor("Max_Current", 2)).isPresent();
    }

    @Test
    @DisplayName("Should normalise ranges of negative values")
    void shouldNormaliseNegativeValues() {
        ParameterRange range = table.rangeFor("threshold", -10).orElseThrow();

        assertThat(range.minValue()).isCloseTo(-15, within(1e-9));
        assertThat(range.maxValue()).isCloseTo(-5, within(1e-9));
        assertThat(range.step()).isCloseTo(1, within(1e-9));
        assertThat(range.isSearchable()).isTrue();
    }

    @Test
    @DisplayName("Should collapse the range of a zero value")
    void shouldCollapseZeroRange() {
        ParameterRange range = table.rangeFor("threshold", 0).orElseThrow();

        assertThat(range.step()).isZero();
        assertThat(range.isSearchable()).isFalse();
    }
}
