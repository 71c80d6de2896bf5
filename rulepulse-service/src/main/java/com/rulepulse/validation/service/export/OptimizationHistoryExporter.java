/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.service.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.rulepulse.validation.api.model.OptimizationResult;
import com.rulepulse.validation.api.model.OptimizationStrategy;
import com.rulepulse.validation.infra.persistence.JsonMappers;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Writes and reads a rule's optimization history as CSV or JSON.
 *
 * <p>CSV has one row per result with the header
 * {@code Rule ID,Parameter,Original Value,Optimized Value,Improvement,Strategy,Date,Metrics};
 * metrics are packed as {@code name=value;name=value}. JSON is a single document:
 * <pre>
 * {"rule_id": ..., "rule_name": ..., "optimizations": [{"parameter_name": ..., ...}]}
 * </pre>
 *
 * <p>Doubles are written in their shortest round-tripping form, so importing an export
 * yields equal results. Callers own the writer and reader; neither is closed here.
 */
public class OptimizationHistoryExporter {

    private static final String METRIC_SEPARATOR = ";";
    private static final String METRIC_ASSIGN = "=";

    private final ObjectMapper jsonMapper;
    private final CsvMapper csvMapper;
    private final CsvSchema csvSchema;
    private final Tracer tracer;

    public OptimizationHistoryExporter(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.jsonMapper = JsonMappers.defaultMapper();
        this.jsonMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.jsonMapper.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);
        // Quote only values that contain a separator, quote or line break.
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
        this.csvMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.csvMapper.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);
        this.csvSchema = csvMapper.schemaFor(CsvRow.class).withHeader();
    }

    /**
     * @throws IllegalArgumentException if a result belongs to a different rule
     * @throws UncheckedIOException     if the writer fails
     */
    public void export(String ruleId, String ruleName, List<OptimizationResult> results,
                       ExportFormat format, Writer writer) {
        Span span = tracer.spanBuilder("export-optimization-history").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rule.id", ruleId);
            span.setAttribute("format", format.name());
            span.setAttribute("results", results.size());

            for (OptimizationResult result : results) {
                requireRule(ruleId, result.ruleId());
            }
            switch (format) {
                case CSV -> writeCsv(results, writer);
                case JSON -> writeJson(ruleId, ruleName, results, writer);
            }
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * @return the results in document order, all attributed to {@code ruleId}
     * @throws IllegalArgumentException if the document names a different rule
     * @throws UncheckedIOException     if the reader fails or the document is malformed
     */
    public List<OptimizationResult> importHistory(String ruleId, ExportFormat format, Reader reader) {
        Span span = tracer.spanBuilder("import-optimization-history").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rule.id", ruleId);
            span.setAttribute("format", format.name());

            List<OptimizationResult> results = switch (format) {
                case CSV -> readCsv(ruleId, reader);
                case JSON -> readJson(ruleId, reader);
            };
            span.setAttribute("results", results.size());
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void writeCsv(List<OptimizationResult> results, Writer writer) {
        List<CsvRow> rows = new ArrayList<>(results.size());
        for (OptimizationResult result : results) {
            rows.add(CsvRow.of(result));
        }
        try {
            csvMapper.writer(csvSchema).writeValue(writer, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV optimization history", e);
        }
    }

    private List<OptimizationResult> readCsv(String ruleId, Reader reader) {
        try (MappingIterator<CsvRow> rows = csvMapper.readerFor(CsvRow.class).with(csvSchema).readValues(reader)) {
            List<OptimizationResult> results = new ArrayList<>();
            while (rows.hasNextValue()) {
                CsvRow row = rows.nextValue();
                requireRule(ruleId, row.ruleId());
                results.add(row.toResult());
            }
            return results;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV optimization history", e);
        }
    }

    private void writeJson(String ruleId, String ruleName, List<OptimizationResult> results, Writer writer) {
        List<JsonEntry> entries = new ArrayList<>(results.size());
        for (OptimizationResult result : results) {
            entries.add(JsonEntry.of(result));
        }
        try {
            jsonMapper.writeValue(writer, new JsonDocument(ruleId, ruleName, entries));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON optimization history", e);
        }
    }

    private List<OptimizationResult> readJson(String ruleId, Reader reader) {
        JsonDocument document;
        try {
            document = jsonMapper.readValue(reader, JsonDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON optimization history", e);
        }
        if (document == null) {
            return List.of();
        }
        requireRule(ruleId, document.ruleId());
        List<OptimizationResult> results = new ArrayList<>(document.optimizations().size());
        for (JsonEntry entry : document.optimizations()) {
            results.add(entry.toResult(ruleId));
        }
        return results;
    }

    private static void requireRule(String expected, String actual) {
        if (!expected.equals(actual)) {
            throw new IllegalArgumentException("Optimization history belongs to rule '" + actual
                    + "', expected '" + expected + "'");
        }
    }

    static String packMetrics(Map<String, Double> metrics) {
        StringJoiner joiner = new StringJoiner(METRIC_SEPARATOR);
        metrics.forEach((name, value) -> joiner.add(name + METRIC_ASSIGN + value));
        return joiner.toString();
    }

    static Map<String, Double> unpackMetrics(String packed) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (packed == null || packed.isBlank()) {
            return metrics;
        }
        for (String pair : packed.split(METRIC_SEPARATOR)) {
            int assign = pair.indexOf(METRIC_ASSIGN);
            if (assign <= 0) {
                throw new IllegalArgumentException("Malformed metric '" + pair + "'");
            }
            String name = pair.substring(0, assign).trim();
            String value = pair.substring(assign + 1).trim();
            try {
                metrics.put(name, Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed value for metric '" + name + "': " + value, e);
            }
        }
        return metrics;
    }

    @JsonPropertyOrder({"Rule ID", "Parameter", "Original Value", "Optimized Value",
            "Improvement", "Strategy", "Date", "Metrics"})
    record CsvRow(
            @JsonProperty("Rule ID") String ruleId,
            @JsonProperty("Parameter") String parameter,
            @JsonProperty("Original Value") double originalValue,
            @JsonProperty("Optimized Value") double optimizedValue,
            @JsonProperty("Improvement") double improvement,
            @JsonProperty("Strategy") String strategy,
            @JsonProperty("Date") String date,
            @JsonProperty("Metrics") String metrics
    ) {
        static CsvRow of(OptimizationResult result) {
            return new CsvRow(result.ruleId(), result.parameterName(), result.originalValue(),
                    result.optimizedValue(), result.improvement(), result.strategy().name(),
                    result.createdAt().toString(), packMetrics(result.metrics()));
        }

        OptimizationResult toResult() {
            return new OptimizationResult(ruleId, parameter, originalValue, optimizedValue, improvement,
                    OptimizationStrategy.valueOf(strategy), unpackMetrics(metrics), Instant.parse(date));
        }
    }

    record JsonDocument(
            @JsonProperty("rule_id") String ruleId,
            @JsonProperty("rule_name") String ruleName,
            @JsonProperty("optimizations") List<JsonEntry> optimizations
    ) {
        JsonDocument {
            optimizations = optimizations == null ? List.of() : List.copyOf(optimizations);
        }
    }

    record JsonEntry(
            @JsonProperty("parameter_name") String parameterName,
            @JsonProperty("original_value") double originalValue,
            @JsonProperty("optimized_value") double optimizedValue,
            @JsonProperty("improvement") double improvement,
            @JsonProperty("strategy") OptimizationStrategy strategy,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("metrics") Map<String, Double> metrics
    ) {
        static JsonEntry of(OptimizationResult result) {
            return new JsonEntry(result.parameterName(), result.originalValue(), result.optimizedValue(),
                    result.improvement(), result.strategy(), result.createdAt(), result.metrics());
        }

        OptimizationResult toResult(String ruleId) {
            return new OptimizationResult(ruleId, parameterName, originalValue, optimizedValue,
                    improvement, strategy, metrics, createdAt);
        }
    }
}
