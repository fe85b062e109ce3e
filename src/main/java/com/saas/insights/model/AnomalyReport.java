package com.saas.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomalies detected for one reference day")
public class AnomalyReport {

    @Schema(description = "Day the metrics were evaluated for", example = "2026-10-18")
    private LocalDate referenceDate;

    @Schema(description = "One alert per anomalous metric")
    private List<Alert> alerts;

    @Schema(description = "Number of anomalous metrics", example = "2")
    private int count;

    @Schema(description = "Number of critical anomalies", example = "1")
    private int criticalCount;

    @Schema(description = "Number of warning anomalies", example = "1")
    private int warningCount;

    public static AnomalyReport of(LocalDate referenceDate, List<Alert> alerts) {
        int critical = (int) alerts.stream().filter(a -> a.getSeverity() == AlertSeverity.CRITICAL).count();
        return AnomalyReport.builder()
                .referenceDate(referenceDate)
                .alerts(alerts)
                .count(alerts.size())
                .criticalCount(critical)
                .warningCount(alerts.size() - critical)
                .build();
    }
}
