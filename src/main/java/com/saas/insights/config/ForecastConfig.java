package com.saas.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "insights.forecast")
public class ForecastConfig {

    // Exponential smoothing factor (0 < alpha <= 1). Higher = more weight on recent weeks.
    private double smoothingAlpha = 0.3;

    // Weekly buckets of history pulled for usage forecasts (12 weeks = 84 days).
    private int historyWeeks = 12;

    // Trailing smoothed weeks the regression line is fitted on; also the growth-rate comparison span.
    private int regressionWeeks = 4;

    // Fixed bands around the point forecast. Heuristic, not a fitted interval.
    private double usageBandFraction = 0.15;
    private double revenueBandFraction = 0.10;

    // Growth (percent) beyond which a usage series is labelled increasing/decreasing.
    private double usageTrendBandPct = 5.0;

    // Assumed monthly revenue growth. Not fitted from historical revenue.
    private double monthlyRevenueGrowth = 0.05;
    private double revenueTrendBand = 0.02;

    // Daily sample metric counted as new customers.
    private String newCustomerMetric = "accounts_created";

    // Monthly price per plan, USD.
    private Map<String, Double> planPrices = new LinkedHashMap<>(Map.of(
            "free", 0.0,
            "pro", 29.0,
            "team", 79.0,
            "enterprise", 249.0));

    public double priceOf(String plan) {
        if (plan == null) return 0.0;
        return planPrices.getOrDefault(plan.toLowerCase(), 0.0);
    }
}
