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
@Schema(description = "A daily metric value to store")
public class MetricSampleRequest {

    @Schema(description = "UTC day the value belongs to. Defaults to today", example = "2026-10-17")
    private LocalDate day;

    @Schema(description = "Metric value", example = "1250.0")
    private Double value;

    @Schema(description = "Add to the stored value instead of replacing it", example = "false")
    private boolean increment;
}
