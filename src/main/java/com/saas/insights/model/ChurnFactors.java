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
@Schema(description = "Individually capped contributions to a churn risk score")
public class ChurnFactors {

    @Schema(description = "Drop in weekly activity, last 30 days vs the 30 before (0-30)", example = "18.0")
    private double activityDrop;

    @Schema(description = "Coarse billing indicator, non-zero only for paying plans (0-25)", example = "5.0")
    private double paymentIssues;

    @Schema(description = "Low product event volume in the last 30 days (0-20)", example = "17.5")
    private double featureUsage;

    @Schema(description = "Negative sentiment of recent content (0-15, 7.5 when unknown)", example = "7.5")
    private double sentimentTrend;

    @Schema(description = "Two points per distinct support error in the last 30 days (0-10)", example = "4.0")
    private double errorFrequency;

    public double total() {
        return activityDrop + paymentIssues + featureUsage + sentimentTrend + errorFrequency;
    }
}
