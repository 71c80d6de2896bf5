/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.runtime.effectiveness;

import com.rulepulse.validation.api.CommunityMetricsSink;
import com.rulepulse.validation.api.exceptions.RuleNotFoundException;
import com.rulepulse.validation.api.model.EffectivenessStatus;
import com.rulepulse.validation.api.model.EffectivenessSummary;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.api.model.RuleMetricsSnapshot;
import com.rulepulse.validation.api.model.ValidationCategory;
import com.rulepulse.validation.api.model.ValidationRule;
import com.rulepulse.validation.api.model.ValidationSeverity;
import com.rulepulse.validation.infra.config.EffectivenessPolicy;
import com.rulepulse.validation.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.rulepulse.validation.infra.persistence.InMemoryRecordStore;
import com.rulepulse.validation.infra.persistence.JsonFileRecordStore;
import com.rulepulse.validation.infra.persistence.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleEffectivenessTrackerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private CommunityMetricsSink sink;

    @Mock
    private RecordStore<RuleEffectiveness> failingStore;

    @TempDir
    Path tempDir;

    private InMemoryMetricsRegistry metrics;
    private ValidationRule rule;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        rule = ValidationRule.builder("r1")
                .name("Ground plane continuity")
                .category(ValidationCategory.GROUND)
                .severity(ValidationSeverity.ERROR)
                .parameter("threshold", 1000)
                .build();
    }

    private RuleEffectivenessTracker newTracker(RecordStore<RuleEffectiveness> store, CommunityMetricsSink metricsSink) {
        return new RuleEffectivenessTracker(store, metricsSink, EffectivenessPolicy.defaults(), metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private RuleEffectivenessTracker newTracker() {
        return newTracker(new InMemoryRecordStore<>(), CommunityMetricsSink.noop());
    }

    @Test
    @DisplayName("Should classify a passing, well-rated rule as EFFECTIVE")
    void shouldClassifyEffectiveRule() {
        // Given
        RuleEffectivenessTracker tracker = newTracker();

        // When
        for (int i = 0; i < 10; i++) {
            tracker.trackValidation(rule, true);
        }
        for (int i = 0; i < 8; i++) {
            tracker.addFeedback("r1", true);
        }
        tracker.addFeedback("r1", false);
        RuleEffectiveness result = tracker.addFeedback("r1", false);

        // Then
        assertThat(result.status()).isEqualTo(EffectivenessStatus.EFFECTIVE);
        assertThat(result.totalValidations()).isEqualTo(10);
        assertThat(result.feedbackCount()).isEqualTo(10);
        assertThat(tracker.getEffectiveRules()).extracting(RuleEffectiveness::ruleId).containsExactly("r1");
    }

    @Test
    @DisplayName("Should classify a failing, disliked rule as INEFFECTIVE")
    void shouldClassifyIneffectiveRule() {
        RuleEffectivenessTracker tracker = newTracker();

        for (int i = 0; i < 10; i++) {
            tracker.trackValidation(rule, false, ValidationSeverity.ERROR);
        }
        for (int i = 0; i < 8; i++) {
            tracker.addFeedback("r1", false);
        }

        RuleEffectiveness result = tracker.getRuleEffectiveness("r1").orElseThrow();
        assertThat(result.status()).isEqualTo(EffectivenessStatus.INEFFECTIVE);
        assertThat(result.averageSeverity()).isEqualTo(2.0);
        assertThat(tracker.getIneffectiveRules()).extracting(RuleEffectiveness::ruleId).contains("r1");
    }

    @Test
    @DisplayName("Should stay UNKNOWN until both sample minimums are reached")
    void shouldStayUnknownUntilSamplesAreAdequate() {
        RuleEffectivenessTracker tracker = newTracker();

        for (int i = 0; i < 9; i++) {
            assertThat(tracker.trackValidation(rule, true).status()).isEqualTo(EffectivenessStatus.UNKNOWN);
        }
        for (int i = 0; i < 4; i++) {
            assertThat(tracker.addFeedback("r1", true).status()).isEqualTo(EffectivenessStatus.UNKNOWN);
        }
        assertThat(tracker.trackValidation(rule, true).status()).isEqualTo(EffectivenessStatus.UNKNOWN);
        assertThat(tracker.addFeedback("r1", true).status()).isEqualTo(EffectivenessStatus.EFFECTIVE);
    }

    @Test
    @DisplayName("Should reject feedback for a rule that was never tracked")
    void shouldRejectFeedbackForUnknownRule() {
        RuleEffectivenessTracker tracker = newTracker();

        assertThatThrownBy(() -> tracker.addFeedback("missing", true))
                .isInstanceOf(RuleNotFoundException.class)
                .hasMessageContaining("missing");
        assertThat(tracker.getRuleEffectiveness("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should create the record lazily when feedback names a registered rule")
    void shouldCreateRecordOnFirstFeedbackForRule() {
        RuleEffectivenessTracker tracker = newTracker();

        RuleEffectiveness result = tracker.addFeedback(rule, false);

        assertThat(result.ruleName()).isEqualTo("Ground plane continuity");
        assertThat(result.category()).isEqualTo(ValidationCategory.GROUND);
        assertThat(result.totalValidations()).isZero();
        assertThat(result.negativeFeedback()).isEqualTo(1);
        assertThat(result.lastUpdated()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should reload persisted records on construction")
    void shouldReloadPersistedRecords() {
        // Given
        JsonFileRecordStore<RuleEffectiveness> store =
                new JsonFileRecordStore<>(tempDir.resolve("effectiveness"), RuleEffectiveness.class);
        RuleEffectivenessTracker first = newTracker(store, CommunityMetricsSink.noop());
        for (int i = 0; i < 12; i++) {
            first.trackValidation(rule, i % 4 != 0, ValidationSeverity.WARNING);
        }
        for (int i = 0; i < 6; i++) {
            first.addFeedback("r1", true);
        }
        RuleEffectiveness before = first.getRuleEffectiveness("r1").orElseThrow();

        // When
        RuleEffectivenessTracker second = newTracker(
                new JsonFileRecordStore<>(tempDir.resolve("effectiveness"), RuleEffectiveness.class),
                CommunityMetricsSink.noop());

        // Then
        assertThat(second.getRuleEffectiveness("r1")).contains(before);
        assertThat(second.addFeedback("r1", false).feedbackCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should keep tracking when the metrics sink throws")
    void shouldAbsorbSinkFailures() {
        doThrow(new IllegalStateException("sink down")).when(sink).publish(any());
        RuleEffectivenessTracker tracker = newTracker(new InMemoryRecordStore<>(), sink);

        RuleEffectiveness result = tracker.trackValidation(rule, false);

        assertThat(result.failedValidations()).isEqualTo(1);
        verify(sink).publish(any(RuleMetricsSnapshot.class));
    }

    @Test
    @DisplayName("Should keep tracking when the store cannot be written")
    void shouldAbsorbStoreFailures() {
        when(failingStore.loadAll()).thenReturn(Map.of());
        doThrow(new UncheckedIOException(new IOException("disk full"))).when(failingStore).save(anyString(), any());
        RuleEffectivenessTracker tracker = newTracker(failingStore, CommunityMetricsSink.noop());

        tracker.trackValidation(rule, true);
        tracker.trackValidation(rule, true);

        assertThat(tracker.getRuleEffectiveness("r1")).map(RuleEffectiveness::totalValidations).contains(2L);
        assertThat(metrics.counterValue("rulepulse_persistence_failures_total", "store", "effectiveness"))
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Should publish a snapshot after every validation")
    void shouldPublishSnapshotAfterValidation() {
        RuleEffectivenessTracker tracker = newTracker(new InMemoryRecordStore<>(), sink);

        tracker.trackValidation(rule, true);
        tracker.trackValidation(rule, false, ValidationSeverity.CRITICAL);

        ArgumentCaptor<RuleMetricsSnapshot> captor = ArgumentCaptor.forClass(RuleMetricsSnapshot.class);
        verify(sink, times(2)).publish(captor.capture());
        RuleMetricsSnapshot last = captor.getAllValues().get(1);
        assertThat(last.totalValidations()).isEqualTo(2);
        assertThat(last.failedValidations()).isEqualTo(1);
        assertThat(last.failureRate()).isEqualTo(0.5);
        assertThat(last.averageSeverity()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should not lose concurrent updates to the same rule")
    void shouldNotLoseConcurrentUpdates() throws Exception {
        RuleEffectivenessTracker tracker = newTracker();
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                boolean passed = t % 2 == 0;
                tasks.add(() -> {
                    for (int i = 0; i < perThread; i++) {
                        tracker.trackValidation(rule, passed);
                        tracker.addFeedback(rule, passed);
                    }
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        RuleEffectiveness result = tracker.getRuleEffectiveness("r1").orElseThrow();
        assertThat(result.totalValidations()).isEqualTo(threads * perThread);
        assertThat(result.passedValidations() + result.failedValidations()).isEqualTo(result.totalValidations());
        assertThat(result.passedValidations()).isEqualTo(threads * perThread / 2);
        assertThat(result.feedbackCount()).isEqualTo(threads * perThread);
        assertThat(result.positiveFeedback() + result.negativeFeedback()).isEqualTo(result.feedbackCount());
    }

    @Test
    @DisplayName("Should summarise statuses across rules and be idempotent")
    void shouldSummariseStatuses() {
        RuleEffectivenessTracker tracker = newTracker();
        ValidationRule other = ValidationRule.builder("r2").build();
        ValidationRule fresh = ValidationRule.builder("r3").build();
        for (int i = 0; i < 10; i++) {
            tracker.trackValidation(rule, true);
            tracker.trackValidation(other, false);
        }
        for (int i = 0; i < 5; i++) {
            tracker.addFeedback("r1", true);
            tracker.addFeedback("r2", false);
        }
        tracker.trackValidation(fresh, true);

        EffectivenessSummary summary = tracker.getEffectivenessSummary();

        assertThat(summary).isEqualTo(new EffectivenessSummary(3, 1, 1, 0, 1.0 / 3));
        assertThat(tracker.getEffectivenessSummary()).isEqualTo(summary);
        assertThat(tracker.getAllEffectiveness()).extracting(RuleEffectiveness::ruleId)
                .containsExactly("r1", "r2", "r3");
    }

    @Test
    @DisplayName("Should report an all-zero summary when nothing is tracked")
    void shouldReportEmptySummary() {
        assertThat(newTracker().getEffectivenessSummary()).isEqualTo(new EffectivenessSummary(0, 0, 0, 0, 0.0));
    }

    @Test
    @DisplayName("Should wipe memory and store on reset")
    void shouldWipeOnReset() {
        InMemoryRecordStore<RuleEffectiveness> store = new InMemoryRecordStore<>();
        RuleEffectivenessTracker tracker = newTracker(store, CommunityMetricsSink.noop());
        tracker.trackValidation(rule, true);

        tracker.reset();

        assertThat(tracker.getAllEffectiveness()).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should wait for an in-flight update before wiping its rule on reset")
    void shouldWaitForInFlightUpdateOnReset() throws Exception {
        // Given a store whose next save blocks until released
        InMemoryRecordStore<RuleEffectiveness> delegate = new InMemoryRecordStore<>();
        CountDownLatch saving = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RecordStore<RuleEffectiveness> blockingStore = new RecordStore<>() {
            @Override
            public Optional<RuleEffectiveness> load(String key) {
                return delegate.load(key);
            }

            @Override
            public Map<String, RuleEffectiveness> loadAll() {
                return delegate.loadAll();
            }

            @Override
            public void save(String key, RuleEffectiveness record) {
                saving.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                delegate.save(key, record);
            }

            @Override
            public boolean delete(String key) {
                return delegate.delete(key);
            }

            @Override
            public void clear() {
                delegate.clear();
            }
        };
        RuleEffectivenessTracker tracker = newTracker(blockingStore, CommunityMetricsSink.noop());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<RuleEffectiveness> update = executor.submit(() -> tracker.trackValidation(rule, false));
            assertThat(saving.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            Future<?> reset = executor.submit(tracker::reset);

            // Then
            assertThatThrownBy(() -> reset.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
            release.countDown();
            update.get(5, TimeUnit.SECONDS);
            reset.get(5, TimeUnit.SECONDS);
            assertThat(tracker.getAllEffectiveness()).isEmpty();
            assertThat(delegate.size()).isZero();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should count tracked validations and feedback by outcome")
    void shouldCountEvents() {
        RuleEffectivenessTracker tracker = newTracker();

        tracker.trackValidation(rule, true);
        tracker.trackValidation(rule, false);
        tracker.trackValidation(rule, false);
        tracker.addFeedback("r1", true);

        assertThat(metrics.counterValue("rulepulse_validations_tracked_total", "outcome", "passed")).isEqualTo(1);
        assertThat(metrics.counterValue("rulepulse_validations_tracked_total", "outcome", "failed")).isEqualTo(2);
        assertThat(metrics.counterValue("rulepulse_feedback_total", "sentiment", "positive")).isEqualTo(1);
    }
}
