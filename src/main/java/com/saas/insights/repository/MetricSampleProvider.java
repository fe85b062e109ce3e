package com.saas.insights.repository;

import java.time.LocalDate;

/**
 * Source of daily metric values. The engine does not know how a value is derived
 * (counts, ratios, sums); it only consumes the number.
 */
public interface MetricSampleProvider {

    /**
     * Value of {@code metric} over {@code [dayStart, dayEnd)}. A one-day interval returns that
     * day's value; longer intervals return the sum of the daily values. Missing days count as 0.
     */
    double getValue(String metric, LocalDate dayStart, LocalDate dayEnd);

    /**
     * Whether the backing store can currently be reached.
     */
    default boolean isAvailable() {
        return true;
    }
}
