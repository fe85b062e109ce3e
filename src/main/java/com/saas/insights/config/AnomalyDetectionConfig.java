package com.saas.insights.config;

import com.saas.insights.model.MetricConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "insights.anomaly")
public class AnomalyDetectionConfig {

    // Trailing days the baseline mean/std-dev is computed over.
    private int windowDays = 7;

    // A deviation at or above threshold * multiplier escalates WARNING to CRITICAL.
    private double criticalMultiplier = 1.5;

    // When true, a metric with minConsecutiveIntervals = N only alerts after N anomalous days in a row.
    private boolean enforceMinConsecutiveIntervals = true;

    private List<MetricConfig> metrics = new ArrayList<>(List.of(
            MetricConfig.builder().metricName("file_conversion_success_rate")
                    .percentThreshold(30).stdDevThreshold(2).minConsecutiveIntervals(1).build(),
            MetricConfig.builder().metricName("export_success_rate")
                    .percentThreshold(30).stdDevThreshold(2).minConsecutiveIntervals(1).build(),
            // generation latency is noisier: wider band and two bad days in a row
            MetricConfig.builder().metricName("p95_generation_time_ms")
                    .percentThreshold(50).stdDevThreshold(2).minConsecutiveIntervals(2).build(),
            MetricConfig.builder().metricName("daily_token_cost")
                    .percentThreshold(50).stdDevThreshold(2).minConsecutiveIntervals(1).build(),
            MetricConfig.builder().metricName("daily_content_created")
                    .percentThreshold(40).stdDevThreshold(2).minConsecutiveIntervals(1).build()));
}
