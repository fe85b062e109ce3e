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
@Schema(description = "Inputs and by-products of a revenue forecast")
public class RevenueFactors {

    @Schema(description = "Monthly recurring revenue of active subscriptions today", example = "12450")
    private double currentMrr;

    @Schema(description = "Forecasted MRR times 12", example = "165000")
    private double forecastedArr;

    @Schema(description = "Accounts created in the last 30 days", example = "84")
    private long newCustomers;

    @Schema(description = "Percent of active subscriptions canceled in the last 30 days", example = "2.4")
    private double churnRate;

    @Schema(description = "Expansion revenue rate; upgrades are not tracked yet", example = "0.0")
    private double expansionRate;
}
