package com.saas.insights.engine;

import com.saas.insights.model.MovingWindowStats;
import com.saas.insights.repository.MetricSampleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Trailing-window mean and population standard deviation of a daily metric.
 */
@Component
public class MovingStatisticsCalculator {

    private static final Logger log = LoggerFactory.getLogger(MovingStatisticsCalculator.class);

    private final MetricSampleProvider provider;

    public MovingStatisticsCalculator(MetricSampleProvider provider) {
        this.provider = provider;
    }

    /**
     * Stats over the {@code windowDays} days ending the day before {@code referenceDate}.
     * Missing days count as 0. Returns {@link MovingWindowStats#empty()} when the provider
     * is unavailable.
     */
    public MovingWindowStats calculate(String metric, LocalDate referenceDate, int windowDays) {
        if (windowDays <= 0 || !provider.isAvailable()) {
            log.debug("No history for {}: provider unavailable or empty window", metric);
            return MovingWindowStats.empty();
        }

        List<Double> values = new ArrayList<>(windowDays);
        for (int i = windowDays; i >= 1; i--) {
            LocalDate day = referenceDate.minusDays(i);
            values.add(provider.getValue(metric, day, day.plusDays(1)));
        }

        double mean = values.stream().mapToDouble(Double::doubleValue).sum() / values.size();
        double variance = values.stream()
                .mapToDouble(v -> (v - mean) * (v - mean))
                .sum() / values.size();

        return new MovingWindowStats(mean, Math.sqrt(variance), List.copyOf(values));
    }
}
