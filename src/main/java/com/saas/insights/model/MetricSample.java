package com.saas.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Value of a metric for one calendar day (UTC)")
public class MetricSample {

    @Schema(description = "Metric identifier", example = "daily_token_cost")
    private String metric;

    @Schema(description = "Day the value belongs to", example = "2026-10-17")
    private LocalDate day;

    @Schema(description = "Scalar value of the metric for that day", example = "12.75")
    private double value;
}
