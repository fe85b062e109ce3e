package com.saas.insights.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metricsInsightsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metrics Insights API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection, forecasting and alerting for the analytics dashboard.\n\n" +
                                "**Anomaly Detection:**\n" +
                                "Each monitored daily metric is compared against its trailing 7-day mean and " +
                                "population standard deviation. A percent or sigma deviation at or above the " +
                                "metric's threshold raises a WARNING; 1.5x the threshold raises CRITICAL.\n\n" +
                                "**Forecasts:**\n" +
                                "- `tokens`, `content-units`, `new-accounts`: exponential smoothing over 12 weekly " +
                                "buckets plus a linear fit of the last 4 weeks, ±15% band\n" +
                                "- revenue: current MRR compounded at an assumed 5% monthly growth, ±10% band\n\n" +
                                "**Churn Risk:** five capped factors summed to a 0-100 score.\n\n" +
                                "**Alert Rules:** `gt`, `gte`, `lt`, `lte`, `eq` thresholds on `error_rate`, " +
                                "`churn_risk`, `token_usage`, `job_failure_rate`, `active_users`, `custom`. " +
                                "At most one open alert exists per rule.")
                        .contact(new Contact().name("Analytics Platform Team")));
    }
}
