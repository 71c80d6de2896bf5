/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.optimizer.optimization;

import com.rulepulse.validation.api.model.OptimizationHistory;
import com.rulepulse.validation.api.model.OptimizationResult;
import com.rulepulse.validation.api.model.OptimizationStrategy;
import com.rulepulse.validation.api.model.OptimizationSummary;
import com.rulepulse.validation.api.model.ParameterRange;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.api.model.ValidationRule;
import com.rulepulse.validation.api.model.ValidationSeverity;
import com.rulepulse.validation.infra.persistence.InMemoryRecordStore;
import com.rulepulse.validation.infra.persistence.RecordStore;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Searches a rule's numeric parameters for values that would have served the recorded
 * history better under a chosen {@link OptimizationStrategy}.
 *
 * <p>No historical input is replayed. A candidate value is scored by projecting the rule's
 * observed statistics through a deterministic heuristic: moving a parameter in its
 * loosening direction by a relative amount {@code shift} scales the failure rate and the
 * average severity by {@code (1 - shift)} and moves the positive-feedback ratio towards the
 * negative one by {@code shift}. The projection is a ranking aid, not a prediction.
 *
 * <h2>Grid search</h2>
 * <p>Each parameter with a range from {@link ParameterRangeTable} is scanned from min to max
 * in {@code step} increments, at most {@value #MAX_CANDIDATES} candidates per parameter.
 * Parameters with a zero step or a non-finite value are skipped. Only candidates that score
 * strictly better than the current value are returned.
 *
 * <h2>History</h2>
 * <p>Returned results are appended to a per-rule history, optionally bounded and persisted
 * through a {@link RecordStore}.
 */
public class RuleParameterOptimizer {

    private static final Logger logger = Logger.getLogger(RuleParameterOptimizer.class.getName());

    /**
     * Upper bound on grid points evaluated for one parameter.
     */
    public static final int MAX_CANDIDATES = 1000;

    /**
     * Score gains at or below this are treated as no improvement.
     */
    static final double MIN_IMPROVEMENT = 1e-9;

    /**
     * Penalty per unit of relative change under MAXIMIZE_PASS_RATE, so that equal pass rates
     * prefer the smaller change.
     */
    static final double CHANGE_PENALTY = 0.1;

    private static final MathContext CANDIDATE_PRECISION = new MathContext(12);

    private final ParameterRangeTable ranges;
    private final Tracer tracer;
    private final RecordStore<OptimizationHistory> historyStore;
    private final int maxHistoryPerRule;
    private final Clock clock;
    private final ConcurrentMap<String, List<OptimizationResult>> history = new ConcurrentHashMap<>();

    public RuleParameterOptimizer(Tracer tracer) {
        this(ParameterRangeTable.defaults(), tracer, new InMemoryRecordStore<>(), 0, Clock.systemUTC());
    }

    /**
     * @param maxHistoryPerRule entries kept per rule; older runs are evicted first and a run
     *                          larger than the cap keeps its best entries; 0 keeps everything
     */
    public RuleParameterOptimizer(ParameterRangeTable ranges,
                                  Tracer tracer,
                                  RecordStore<OptimizationHistory> historyStore,
                                  int maxHistoryPerRule,
                                  Clock clock) {
        if (maxHistoryPerRule < 0) {
            throw new IllegalArgumentException("maxHistoryPerRule must not be negative: " + maxHistoryPerRule);
        }
        this.ranges = Objects.requireNonNull(ranges, "ranges must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
        this.maxHistoryPerRule = maxHistoryPerRule;
        this.clock = clock != null ? clock : Clock.systemUTC();
        loadPersisted();
    }

    /**
     * Grid-searches every optimizable numeric parameter of {@code rule}.
     *
     * @return improving candidates, best first; empty when the rule has no optimizable
     *         parameter or nothing beats the current values
     */
    public List<OptimizationResult> optimizeParameters(ValidationRule rule,
                                                       RuleEffectiveness effectiveness,
                                                       OptimizationStrategy strategy) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        RuleEffectiveness stats = effectiveness != null ? effectiveness : RuleEffectiveness.empty(rule);

        Span span = tracer.spanBuilder("optimize-rule-parameters").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rule.id", rule.id());
            span.setAttribute("strategy", strategy.name());

            Instant now = clock.instant();
            List<OptimizationResult> results = new ArrayList<>();
            for (Map.Entry<String, Double> parameter : rule.numericParameters().entrySet()) {
                results.addAll(optimizeParameter(rule.id(), parameter.getKey(), parameter.getValue(),
                        stats, strategy, now));
            }
            results.sort(Comparator.comparingDouble(OptimizationResult::improvement).reversed()
                    .thenComparing(OptimizationResult::parameterName)
                    .thenComparingDouble(OptimizationResult::optimizedValue));

            if (!results.isEmpty()) {
                recordHistory(rule.id(), results);
            }
            span.setAttribute("results", results.size());
            logger.fine(() -> "Optimization of " + rule.id() + " with " + strategy + " produced "
                    + results.size() + " candidates");
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Optional<ParameterRange> getParameterRange(String parameterName, double currentValue) {
        return ranges.rangeFor(parameterName, currentValue);
    }

    /**
     * Scores a candidate value on 0..1 for the given strategy. The current value itself
     * scores the baseline against which improvements are measured.
     */
    public double evaluateParameter(String parameterName,
                                    double currentValue,
                                    double candidateValue,
                                    RuleEffectiveness effectiveness,
                                    OptimizationStrategy strategy) {
        Map<String, Double> metrics = calculateMetrics(parameterName, currentValue, candidateValue, effectiveness);
        return score(metrics, shift(parameterName, currentValue, candidateValue), strategy);
    }

    /**
     * Projected {@code failure_rate}, {@code pass_rate}, {@code average_severity} and
     * {@code feedback_score} for a candidate value.
     */
    public Map<String, Double> calculateMetrics(String parameterName,
                                                double currentValue,
                                                double candidateValue,
                                                RuleEffectiveness effectiveness) {
        double shift = shift(parameterName, currentValue, candidateValue);

        double failureRate = clamp(effectiveness.failureRate() * (1 - shift), 0.0, 1.0);
        double severity = clamp(effectiveness.averageSeverity() * (1 - shift), 0.0, ValidationSeverity.maxLevel());

        double positive = 0.5;
        double negative = 0.5;
        if (effectiveness.feedbackCount() > 0) {
            positive = effectiveness.positiveFeedbackRatio();
            negative = effectiveness.negativeFeedbackRatio();
        }
        double feedbackScore = clamp(positive + shift * (negative - positive), 0.0, 1.0);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(OptimizationResult.FAILURE_RATE, failureRate);
        metrics.put(OptimizationResult.PASS_RATE, 1.0 - failureRate);
        metrics.put(OptimizationResult.AVERAGE_SEVERITY, severity);
        metrics.put(OptimizationResult.FEEDBACK_SCORE, feedbackScore);
        return metrics;
    }

    public List<OptimizationResult> getOptimizationHistory(String ruleId) {
        List<OptimizationResult> entries = history.get(ruleId);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    public Optional<OptimizationResult> getBestOptimization(String ruleId) {
        return getOptimizationHistory(ruleId).stream()
                .max(Comparator.comparingDouble(OptimizationResult::improvement));
    }

    public OptimizationSummary getOptimizationSummary(String ruleId) {
        List<OptimizationResult> entries = getOptimizationHistory(ruleId);
        if (entries.isEmpty()) {
            return OptimizationSummary.empty(ruleId);
        }
        double average = entries.stream().mapToDouble(OptimizationResult::improvement).average().orElse(0.0);
        double best = entries.stream().mapToDouble(OptimizationResult::improvement).max().orElse(0.0);
        List<String> parameters = entries.stream()
                .map(OptimizationResult::parameterName)
                .distinct()
                .sorted()
                .toList();
        return new OptimizationSummary(ruleId, entries.size(), average, best, parameters);
    }

    /**
     * Appends results to a rule's history, e.g. when importing a previously exported one.
     */
    public void recordHistory(String ruleId, List<OptimizationResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        history.compute(ruleId, (id, current) -> {
            List<OptimizationResult> merged = new ArrayList<>(current != null ? current : List.of());
            int firstNew = merged.size();
            merged.addAll(results);
            List<OptimizationResult> kept = maxHistoryPerRule > 0
                    ? retain(merged, maxHistoryPerRule, olderRunsFirst(merged, firstNew))
                    : merged;
            persist(id, kept);
            return new CopyOnWriteArrayList<>(kept);
        });
    }

    /**
     * Keeps at most {@code maxEntries} entries of a rule's history. The oldest entries go
     * first; among entries created at the same instant the smallest improvements go first.
     *
     * @return number of entries removed
     */
    public int trimHistory(String ruleId, int maxEntries) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must not be negative: " + maxEntries);
        }
        int[] removed = new int[1];
        history.computeIfPresent(ruleId, (id, current) -> {
            if (current.size() <= maxEntries) {
                return current;
            }
            List<OptimizationResult> entries = List.copyOf(current);
            Comparator<Integer> oldestWeakestFirst = Comparator
                    .comparing((Integer i) -> entries.get(i).createdAt())
                    .thenComparingDouble(i -> entries.get(i).improvement())
                    .thenComparing(Comparator.naturalOrder());
            List<OptimizationResult> kept = retain(entries, maxEntries, oldestWeakestFirst);
            removed[0] = entries.size() - kept.size();
            persist(id, kept);
            return new CopyOnWriteArrayList<>(kept);
        });
        return removed[0];
    }

    /**
     * Removes a rule's history from memory and from the store. Runs in the same per-rule
     * critical section as {@link #recordHistory}, so a concurrent append lands either
     * before the removal or in a fresh history.
     */
    public void clearHistory(String ruleId) {
        history.compute(ruleId, (id, current) -> {
            try {
                historyStore.delete(id);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to delete persisted optimization history for rule " + id, e);
            }
            return null;
        });
    }

    public void clearAllHistory() {
        history.clear();
        try {
            historyStore.clear();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to clear persisted optimization history", e);
        }
    }

    private List<OptimizationResult> optimizeParameter(String ruleId,
                                                       String parameterName,
                                                       double currentValue,
                                                       RuleEffectiveness effectiveness,
                                                       OptimizationStrategy strategy,
                                                       Instant now) {
        Optional<ParameterRange> maybeRange = ranges.rangeFor(parameterName, currentValue);
        if (maybeRange.isEmpty()) {
            return List.of();
        }
        ParameterRange range = maybeRange.get();
        if (!range.isSearchable()) {
            logger.fine(() -> "Skipping " + ruleId + "." + parameterName + ": no searchable range for " + currentValue);
            return List.of();
        }

        double baseline = evaluateParameter(parameterName, currentValue, currentValue, effectiveness, strategy);
        long points = Math.min(MAX_CANDIDATES,
                (long) Math.floor((range.maxValue() - range.minValue()) / range.step() + 1e-9) + 1);

        List<OptimizationResult> results = new ArrayList<>();
        for (long i = 0; i < points; i++) {
            double candidate = round(range.minValue() + i * range.step());
            if (candidate == currentValue) {
                continue;
            }
            Map<String, Double> metrics = calculateMetrics(parameterName, currentValue, candidate, effectiveness);
            double score = score(metrics, shift(parameterName, currentValue, candidate), strategy);
            double improvement = score - baseline;
            if (improvement > MIN_IMPROVEMENT) {
                metrics.put(OptimizationResult.SCORE, score);
                results.add(new OptimizationResult(ruleId, parameterName, currentValue, candidate,
                        improvement, strategy, metrics, now));
            }
        }
        return results;
    }

    private double shift(String parameterName, double currentValue, double candidateValue) {
        if (currentValue == 0.0 || !Double.isFinite(currentValue) || !Double.isFinite(candidateValue)) {
            return 0.0;
        }
        int sign = ranges.heuristicFor(parameterName)
                .map(h -> h.loosening().sign())
                .orElse(1);
        return sign * (candidateValue - currentValue) / Math.abs(currentValue);
    }

    private static double score(Map<String, Double> metrics, double shift, OptimizationStrategy strategy) {
        return switch (strategy) {
            case MINIMIZE_FAILURES -> 1.0 - metrics.get(OptimizationResult.FAILURE_RATE);
            case MAXIMIZE_PASS_RATE -> clamp(metrics.get(OptimizationResult.PASS_RATE)
                    - CHANGE_PENALTY * Math.abs(shift), 0.0, 1.0);
            case BALANCE_SEVERITY -> 1.0 - metrics.get(OptimizationResult.AVERAGE_SEVERITY) / ValidationSeverity.maxLevel();
            case OPTIMIZE_FEEDBACK -> metrics.get(OptimizationResult.FEEDBACK_SCORE);
        };
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value) {
        return new BigDecimal(value).round(CANDIDATE_PRECISION).doubleValue();
    }

    /**
     * Eviction order for an append: entries of earlier runs in insertion order, then the
     * new batch from its smallest improvement up. A batch larger than the cap keeps its best.
     */
    private static Comparator<Integer> olderRunsFirst(List<OptimizationResult> entries, int firstNew) {
        return (a, b) -> {
            boolean aOld = a < firstNew;
            boolean bOld = b < firstNew;
            if (aOld != bOld) {
                return aOld ? -1 : 1;
            }
            if (aOld) {
                return Integer.compare(a, b);
            }
            int byImprovement = Double.compare(entries.get(a).improvement(), entries.get(b).improvement());
            return byImprovement != 0 ? byImprovement : Integer.compare(b, a);
        };
    }

    /** Drops the first {@code size - limit} indices in {@code evictionOrder}, keeping list order. */
    private static List<OptimizationResult> retain(List<OptimizationResult> entries,
                                                   int limit,
                                                   Comparator<Integer> evictionOrder) {
        int excess = entries.size() - limit;
        if (excess <= 0) {
            return entries;
        }
        Set<Integer> evicted = IntStream.range(0, entries.size())
                .boxed()
                .sorted(evictionOrder)
                .limit(excess)
                .collect(Collectors.toSet());
        List<OptimizationResult> kept = new ArrayList<>(limit);
        for (int i = 0; i < entries.size(); i++) {
            if (!evicted.contains(i)) {
                kept.add(entries.get(i));
            }
        }
        return kept;
    }

    private void persist(String ruleId, List<OptimizationResult> entries) {
        try {
            historyStore.save(ruleId, new OptimizationHistory(ruleId, new ArrayList<>(entries)));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to persist optimization history for rule " + ruleId, e);
        }
    }

    private void loadPersisted() {
        try {
            historyStore.loadAll().forEach((ruleId, stored) ->
                    history.put(stored.ruleId() != null ? stored.ruleId() : ruleId,
                            new CopyOnWriteArrayList<>(stored.entries())));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Could not load persisted optimization history, starting empty", e);
        }
    }
}
