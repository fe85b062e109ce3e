package com.saas.insights.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger openAlertCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.openAlertCount = registry.gauge("alerts.open.count", new AtomicInteger(0));
    }

    public void recordAnomalyDetected(String metric, String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("metric", metric)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordRuleTriggered(String metricKind) {
        Counter.builder("rule.triggered.count")
                .tag("metric", metricKind)
                .register(registry)
                .increment();
    }

    public void recordAlertCreated(String sourceType) {
        Counter.builder("alert.created.count")
                .tag("source_type", sourceType)
                .register(registry)
                .increment();
    }

    public void recordAlertDeduplicated(String sourceType) {
        Counter.builder("alert.deduplicated.count")
                .tag("source_type", sourceType)
                .register(registry)
                .increment();
    }

    public void recordAlertPersistFailure(String sourceType) {
        Counter.builder("alert.persist.failure.count")
                .tag("source_type", sourceType)
                .register(registry)
                .increment();
    }

    public void recordAlertTransition(String action, String outcome) {
        Counter.builder("alert.transition.count")
                .tag("action", action)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDataFallback(String operation, String stage) {
        Counter.builder("data.fallback.count")
                .tag("operation", operation)
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordChurnScore(double riskScore) {
        DistributionSummary.builder("churn.risk_score")
                .register(registry)
                .record(riskScore);
    }

    public void recordForecast(String kind, String period) {
        Counter.builder("forecast.count")
                .tag("kind", kind)
                .tag("period", period)
                .register(registry)
                .increment();
    }

    public void updateOpenAlertCount(int count) {
        openAlertCount.set(count);
    }
}
