package com.saas.insights.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time values of the live metrics rules are evaluated against.
 * A kind that was not captured reads as 0.
 */
public final class MetricsSnapshot {

    private final EnumMap<MetricKind, Double> values;

    private MetricsSnapshot(EnumMap<MetricKind, Double> values) {
        this.values = values;
    }

    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(new EnumMap<>(MetricKind.class));
    }

    public static MetricsSnapshot of(Map<MetricKind, Double> values) {
        EnumMap<MetricKind, Double> copy = new EnumMap<>(MetricKind.class);
        values.forEach((kind, value) -> {
            if (value != null) copy.put(kind, value);
        });
        return new MetricsSnapshot(copy);
    }

    /**
     * Parse a snapshot keyed by metric key ({@code error_rate}) or enum name.
     *
     * @throws IllegalArgumentException on an unknown key
     */
    public static MetricsSnapshot fromKeys(Map<String, Double> raw) {
        EnumMap<MetricKind, Double> parsed = new EnumMap<>(MetricKind.class);
        raw.forEach((key, value) -> {
            if (value != null) parsed.put(MetricKind.fromKey(key), value);
        });
        return new MetricsSnapshot(parsed);
    }

    public MetricsSnapshot with(MetricKind kind, double value) {
        EnumMap<MetricKind, Double> copy = new EnumMap<>(values);
        copy.put(kind, value);
        return new MetricsSnapshot(copy);
    }

    public double valueOf(MetricKind kind) {
        return values.getOrDefault(kind, 0.0);
    }

    public boolean has(MetricKind kind) {
        return values.containsKey(kind);
    }

    public Map<MetricKind, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "MetricsSnapshot" + values;
    }
}
