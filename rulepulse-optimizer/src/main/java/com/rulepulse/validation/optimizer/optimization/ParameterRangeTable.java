/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.optimizer.optimization;

import com.rulepulse.validation.api.model.ParameterRange;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Derives a search range for a numeric rule parameter from its name.
 *
 * <p>Entries are checked in order and the first match wins. Bounds and step are multiples
 * of the current value:
 * <pre>
 * name                       min    max    step    loosening
 * threshold, *_threshold     0.5x   1.5x   0.1x    increase
 * min_*                      0      2x     0.1x    decrease
 * max_*                      0.5x   2x     0.1x    increase
 * tolerance, *_tolerance     0      2x     0.05x   increase
 * </pre>
 * Any other name has no range and is never optimized. A current value of 0 yields a
 * collapsed range with a zero step.
 */
public final class ParameterRangeTable {

    /**
     * Which way a parameter moves to make its rule fire less often.
     */
    public enum Loosening {
        INCREASE(1),
        DECREASE(-1);

        private final int sign;

        Loosening(int sign) {
            this.sign = sign;
        }

        public int sign() {
            return sign;
        }
    }

    /**
     * One row of the table.
     */
    public record RangeHeuristic(
            String label,
            Predicate<String> matcher,
            double minFactor,
            double maxFactor,
            double stepFactor,
            Loosening loosening
    ) {
        public boolean matches(String parameterName) {
            return matcher.test(parameterName.toLowerCase(Locale.ROOT));
        }

        public ParameterRange rangeFor(String parameterName, double currentValue) {
            return new ParameterRange(parameterName,
                    currentValue * minFactor,
                    currentValue * maxFactor,
                    currentValue * stepFactor,
                    currentValue);
        }
    }

    private static final ParameterRangeTable DEFAULT = new ParameterRangeTable(List.of(
            new RangeHeuristic("threshold",
                    name -> name.equals("threshold") || name.endsWith("_threshold"),
                    0.5, 1.5, 0.1, Loosening.INCREASE),
            new RangeHeuristic("min_*",
                    name -> name.startsWith("min_"),
                    0.0, 2.0, 0.1, Loosening.DECREASE),
            new RangeHeuristic("max_*",
                    name -> name.startsWith("max_"),
                    0.5, 2.0, 0.1, Loosening.INCREASE),
            new RangeHeuristic("tolerance",
                    name -> name.equals("tolerance") || name.endsWith("_tolerance"),
                    0.0, 2.0, 0.05, Loosening.INCREASE)
    ));

    private final List<RangeHeuristic> heuristics;

    public ParameterRangeTable(List<RangeHeuristic> heuristics) {
        this.heuristics = List.copyOf(heuristics);
    }

    public static ParameterRangeTable defaults() {
        return DEFAULT;
    }

    public List<RangeHeuristic> heuristics() {
        return heuristics;
    }

    public Optional<RangeHeuristic> heuristicFor(String parameterName) {
        if (parameterName == null) {
            return Optional.empty();
        }
        return heuristics.stream().filter(h -> h.matches(parameterName)).findFirst();
    }

    public Optional<ParameterRange> rangeFor(String parameterName, double currentValue) {
        return heuristicFor(parameterName).map(h -> h.rangeFor(parameterName, currentValue));
    }
}
