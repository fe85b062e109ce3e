package com.saas.insights.engine;

import com.saas.insights.config.AnomalyDetectionConfig;
import com.saas.insights.config.MetricsConfig;
import com.saas.insights.model.Alert;
import com.saas.insights.model.AlertSeverity;
import com.saas.insights.model.AlertSourceType;
import com.saas.insights.model.AnomalyReport;
import com.saas.insights.model.MetricConfig;
import com.saas.insights.model.MovingWindowStats;
import com.saas.insights.repository.MetricSampleProvider;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares each configured metric's value on a reference day with its trailing-window
 * baseline and records an alert per anomalous metric.
 *
 * <p>A metric is anomalous when its percent deviation from the mean or its deviation in
 * standard deviations reaches the configured threshold. Reaching {@code criticalMultiplier}
 * times either threshold makes it CRITICAL.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final MetricSampleProvider provider;
    private final MovingStatisticsCalculator statisticsCalculator;
    private final AlertLifecycleManager lifecycleManager;
    private final AnomalyDetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyDetector(MetricSampleProvider provider,
                           MovingStatisticsCalculator statisticsCalculator,
                           AlertLifecycleManager lifecycleManager,
                           AnomalyDetectionConfig config,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.provider = provider;
        this.statisticsCalculator = statisticsCalculator;
        this.lifecycleManager = lifecycleManager;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Sweep every configured metric for {@code referenceDate}. Safe to repeat: a metric that
     * already has an alert for that day yields the stored alert, not a new one.
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public AnomalyReport detectAnomalies(LocalDate referenceDate) {
        List<Alert> alerts = new ArrayList<>();

        for (MetricConfig metricConfig : config.getMetrics()) {
            try {
                detect(metricConfig, referenceDate).ifPresent(alerts::add);
            } catch (Exception e) {
                // One broken metric must not hide the others
                log.error("Anomaly check failed for metric {} on {}: {}",
                        metricConfig.getMetricName(), referenceDate, e.getMessage(), e);
            }
        }

        AnomalyReport report = AnomalyReport.of(referenceDate, alerts);
        log.info("Anomaly sweep for {}: {} anomalies ({} critical, {} warning)",
                referenceDate, report.getCount(), report.getCriticalCount(), report.getWarningCount());
        return report;
    }

    public List<MetricConfig> getMetricConfigs() {
        return List.copyOf(config.getMetrics());
    }

    private Optional<Alert> detect(MetricConfig metricConfig, LocalDate referenceDate) {
        Optional<Deviation> deviation = classify(metricConfig, referenceDate);
        if (deviation.isEmpty()) {
            return Optional.empty();
        }
        if (!persistedLongEnough(metricConfig, referenceDate)) {
            log.debug("{} anomalous on {} but not for {} consecutive days",
                    metricConfig.getMetricName(), referenceDate, metricConfig.getMinConsecutiveIntervals());
            return Optional.empty();
        }

        Deviation d = deviation.get();
        String key = metricConfig.getMetricName() + ":" + referenceDate;
        Alert alert = Alert.builder()
                .alertId(key)
                .source(key)
                .sourceType(AlertSourceType.ANOMALY)
                .label(metricConfig.getMetricName())
                .metric(metricConfig.getMetricName())
                .severity(d.severity())
                .currentValue(d.current())
                .expectedValue(d.stats().mean())
                .deviation(d.percentDeviation())
                .message(describe(metricConfig.getMetricName(), d))
                .triggeredAt(clock.millis())
                .build();

        metricsConfig.recordAnomalyDetected(metricConfig.getMetricName(), d.severity().name());
        return Optional.of(lifecycleManager.recordAnomalyAlert(alert));
    }

    /**
     * Deviation of the metric on {@code day} against the window before it, or empty when
     * normal or when there is no history.
     */
    private Optional<Deviation> classify(MetricConfig metricConfig, LocalDate day) {
        MovingWindowStats stats = statisticsCalculator.calculate(
                metricConfig.getMetricName(), day, config.getWindowDays());
        if (!stats.hasHistory()) {
            return Optional.empty();
        }

        double current = provider.getValue(metricConfig.getMetricName(), day, day.plusDays(1));
        double distance = Math.abs(current - stats.mean());
        double percentDeviation = stats.mean() > 0 ? distance / stats.mean() * 100.0 : 0.0;
        double stdDevDeviation = stats.stdDev() > 0 ? distance / stats.stdDev() : 0.0;

        boolean anomalous = percentDeviation >= metricConfig.getPercentThreshold()
                || stdDevDeviation >= metricConfig.getStdDevThreshold();
        if (!anomalous) {
            return Optional.empty();
        }

        double multiplier = config.getCriticalMultiplier();
        boolean critical = percentDeviation >= metricConfig.getPercentThreshold() * multiplier
                || stdDevDeviation >= metricConfig.getStdDevThreshold() * multiplier;

        return Optional.of(new Deviation(current, stats, percentDeviation, stdDevDeviation,
                critical ? AlertSeverity.CRITICAL : AlertSeverity.WARNING));
    }

    // The N-1 days before the reference day must each be anomalous against their own window.
    private boolean persistedLongEnough(MetricConfig metricConfig, LocalDate referenceDate) {
        int required = metricConfig.getMinConsecutiveIntervals();
        if (!config.isEnforceMinConsecutiveIntervals() || required <= 1) {
            return true;
        }
        for (int i = 1; i < required; i++) {
            if (classify(metricConfig, referenceDate.minusDays(i)).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private String describe(String metric, Deviation d) {
        String direction = d.current() > d.stats().mean() ? "higher" : "lower";
        return String.format(Locale.ROOT, "%s is %.1f%% %s than %d-day average (expected %.2f, current %.2f)",
                metric, d.percentDeviation(), direction, config.getWindowDays(),
                d.stats().mean(), d.current());
    }

    private record Deviation(double current, MovingWindowStats stats,
                             double percentDeviation, double stdDevDeviation, AlertSeverity severity) {
    }
}
