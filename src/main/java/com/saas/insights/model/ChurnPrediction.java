package com.saas.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Churn risk assessment for one subject, computed fresh per request")
public class ChurnPrediction {

    @Schema(description = "Subject (user) identifier", example = "user-1842")
    private String subjectId;

    @Schema(description = "Composite risk score (0-100)", example = "72.5")
    private double riskScore;

    @Schema(description = "Risk bucket derived from the score", example = "HIGH")
    private RiskLevel riskLevel;

    @Schema(description = "Factor breakdown")
    private ChurnFactors factors;

    @Schema(description = "Heuristic churn date, set only when the score is above 70")
    private Instant predictedChurnDate;

    @Schema(description = "Suggested interventions, one per factor over its threshold")
    private List<String> recommendations;

    @Schema(description = "Computation timestamp in epoch milliseconds")
    private long computedAt;
}
