package com.saas.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "insights.churn")
public class ChurnConfig {

    // Length of the "recent" and "previous" activity windows.
    private int activityWindowDays = 30;

    // Flat payment-issue score for paying plans until billing health is wired in.
    private double paidPlanPaymentScore = 5.0;

    // Scores above this get a predicted churn date.
    private double churnDateThreshold = 70.0;

    // Recommendation triggers, one per factor.
    private double activityDropRecommendation = 15.0;
    private double featureUsageRecommendation = 10.0;
    private double sentimentRecommendation = 10.0;
    private double errorFrequencyRecommendation = 5.0;
    private double retentionOfferRecommendation = 80.0;
}
