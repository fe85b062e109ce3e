package com.saas.insights.service;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.model.MetricKind;
import com.saas.insights.model.MetricsSnapshot;
import com.saas.insights.repository.MetricSampleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds a snapshot of today's value for every metric kind that has a sample metric mapped
 * under {@code insights.alerting.snapshot-metrics}.
 */
@Service
public class LiveMetricsService {

    private static final Logger log = LoggerFactory.getLogger(LiveMetricsService.class);

    private final MetricSampleProvider provider;
    private final AlertingConfig alertingConfig;
    private final Clock clock;

    public LiveMetricsService(MetricSampleProvider provider, AlertingConfig alertingConfig, Clock clock) {
        this.provider = provider;
        this.alertingConfig = alertingConfig;
        this.clock = clock;
    }

    public MetricsSnapshot currentSnapshot() {
        LocalDate today = LocalDate.now(clock);
        Map<MetricKind, Double> values = new EnumMap<>(MetricKind.class);

        alertingConfig.getSnapshotMetrics().forEach((kind, sampleMetric) -> {
            double value = provider.getValue(sampleMetric, today, today.plusDays(1));
            values.put(kind, value);
        });

        log.debug("Live snapshot for {}: {}", today, values);
        return MetricsSnapshot.of(values);
    }
}
