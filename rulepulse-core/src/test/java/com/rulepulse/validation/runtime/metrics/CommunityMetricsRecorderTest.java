/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.runtime.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulepulse.validation.api.model.EffectivenessStatus;
import com.rulepulse.validation.api.model.RuleMetricsSnapshot;
import com.rulepulse.validation.api.model.ValidationCategory;
import com.rulepulse.validation.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.rulepulse.validation.infra.persistence.JsonMappers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class CommunityMetricsRecorderTest {

    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
    private final CommunityMetricsRecorder recorder = new CommunityMetricsRecorder(metrics);

    private static RuleMetricsSnapshot snapshot(String ruleId, ValidationCategory category,
                                                long passed, long failed, Instant at) {
        long total = passed + failed;
        return new RuleMetricsSnapshot(ruleId, category, total, passed, failed,
                total == 0 ? 0.0 : (double) failed / total, 1.0, EffectivenessStatus.UNKNOWN, at);
    }

    @Test
    @DisplayName("Should keep the newest snapshot per rule")
    void shouldKeepNewestSnapshot() {
        Instant t0 = Instant.parse("2025-01-01T00:00:00Z");
        recorder.publish(snapshot("r1", ValidationCategory.AUDIO, 3, 1, t0.plusSeconds(10)));
        recorder.publish(snapshot("r1", ValidationCategory.AUDIO, 2, 1, t0));

        assertThat(recorder.latest("r1")).map(RuleMetricsSnapshot::totalValidations).contains(4L);
        assertThat(metrics.gaugeValue("rulepulse_rule_validations", "rule", "r1")).isEqualTo(4.0);
        assertThat(metrics.gaugeValue("rulepulse_rule_failure_rate", "rule", "r1")).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should publish validation counters under their snake_case keys")
    void shouldSerializeSnapshotKeys() throws JsonProcessingException {
        // Given
        ObjectMapper mapper = JsonMappers.defaultMapper();
        RuleMetricsSnapshot snapshot = snapshot("r1", ValidationCategory.AUDIO, 3, 1,
                Instant.parse("2025-01-01T00:00:00Z"));

        // When
        JsonNode json = mapper.readTree(mapper.writeValueAsString(snapshot));

        // Then
        assertThat(json.get("rule_id").asText()).isEqualTo("r1");
        assertThat(json.get("total_validations").asLong()).isEqualTo(4);
        assertThat(json.get("passed_validations").asLong()).isEqualTo(3);
        assertThat(json.get("failed_validations").asLong()).isEqualTo(1);
        assertThat(json.has("total")).isFalse();
        assertThat(mapper.readValue(mapper.writeValueAsString(snapshot), RuleMetricsSnapshot.class))
                .isEqualTo(snapshot);
    }

    @Test
    @DisplayName("Should total validations across rules and per category")
    void shouldTotalAcrossRules() {
        Instant now = Instant.now();
        recorder.publish(snapshot("r1", ValidationCategory.AUDIO, 8, 2, now));
        recorder.publish(snapshot("r2", ValidationCategory.AUDIO, 1, 4, now));
        recorder.publish(snapshot("r3", ValidationCategory.POWER, 5, 0, now));

        CommunityMetricsRecorder.RuleTotals totals = recorder.ruleEffectivenessTotals();

        assertThat(totals).isEqualTo(new CommunityMetricsRecorder.RuleTotals(20, 14, 6));
        assertThat(totals.failureRate()).isEqualTo(0.3);
        assertThat(recorder.totalsByCategory())
                .containsEntry(ValidationCategory.AUDIO, new CommunityMetricsRecorder.RuleTotals(15, 9, 6))
                .containsEntry(ValidationCategory.POWER, new CommunityMetricsRecorder.RuleTotals(5, 5, 0));
    }

    @Test
    @DisplayName("Should report zero totals when empty")
    void shouldReportZeroTotalsWhenEmpty() {
        assertThat(recorder.ruleEffectivenessTotals().failureRate()).isZero();
        assertThat(recorder.snapshots()).isEmpty();
    }
}
