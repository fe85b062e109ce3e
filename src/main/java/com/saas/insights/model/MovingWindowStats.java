package com.saas.insights.model;

import java.util.List;

/**
 * Trailing-window statistics for a metric. {@code values} holds one entry per day
 * of the window, oldest first; days without data contribute 0.
 */
public record MovingWindowStats(double mean, double stdDev, List<Double> values) {

    public static MovingWindowStats empty() {
        return new MovingWindowStats(0.0, 0.0, List.of());
    }

    /**
     * False when the provider could not be reached. Callers must not treat
     * the zero mean of an empty window as a baseline.
     */
    public boolean hasHistory() {
        return !values.isEmpty();
    }
}
