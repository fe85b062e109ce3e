package com.saas.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomaly detection thresholds for one monitored daily metric")
public class MetricConfig {

    @Schema(description = "Metric identifier", example = "export_success_rate")
    private String metricName;

    @Schema(description = "Percent deviation from the 7-day mean that raises an anomaly", example = "30.0")
    private double percentThreshold;

    @Schema(description = "Standard deviations from the 7-day mean that raise an anomaly", example = "2.0")
    private double stdDevThreshold;

    @Schema(description = "Consecutive anomalous days required before alerting", example = "1")
    @Builder.Default
    private int minConsecutiveIntervals = 1;
}
