package com.saas.insights.service;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.config.MetricsConfig;
import com.saas.insights.engine.AlertLifecycleManager;
import com.saas.insights.engine.AlertRuleEvaluator;
import com.saas.insights.engine.AnomalyDetector;
import com.saas.insights.model.Alert;
import com.saas.insights.model.AnomalyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweeps. Both are off by default and switched on with
 * {@code insights.alerting.sweep.anomaly-enabled} / {@code rules-enabled}.
 */
@Service
public class AlertSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(AlertSweepScheduler.class);

    private final AnomalyDetector anomalyDetector;
    private final AlertRuleEvaluator ruleEvaluator;
    private final AlertLifecycleManager lifecycleManager;
    private final LiveMetricsService liveMetricsService;
    private final AlertingConfig alertingConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertSweepScheduler(AnomalyDetector anomalyDetector,
                               AlertRuleEvaluator ruleEvaluator,
                               AlertLifecycleManager lifecycleManager,
                               LiveMetricsService liveMetricsService,
                               AlertingConfig alertingConfig,
                               MetricsConfig metricsConfig,
                               Clock clock) {
        this.anomalyDetector = anomalyDetector;
        this.ruleEvaluator = ruleEvaluator;
        this.lifecycleManager = lifecycleManager;
        this.liveMetricsService = liveMetricsService;
        this.alertingConfig = alertingConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Checks yesterday, the last complete day.
     */
    @Scheduled(cron = "${insights.alerting.sweep.anomaly-cron:0 15 0 * * *}", zone = "UTC")
    public void sweepAnomalies() {
        if (!alertingConfig.getSweep().isAnomalyEnabled()) {
            return;
        }
        LocalDate referenceDate = LocalDate.now(clock).minusDays(1);
        try {
            AnomalyReport report = anomalyDetector.detectAnomalies(referenceDate);
            log.info("Scheduled anomaly sweep for {} found {} anomalies", referenceDate, report.getCount());
            refreshOpenAlertGauge();
        } catch (Exception e) {
            log.error("Scheduled anomaly sweep for {} failed: {}", referenceDate, e.getMessage(), e);
        }
    }

    @Scheduled(fixedRateString = "${insights.alerting.sweep.rule-interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void sweepRules() {
        if (!alertingConfig.getSweep().isRulesEnabled()) {
            return;
        }
        try {
            List<Alert> opened = ruleEvaluator.evaluateAll(liveMetricsService.currentSnapshot());
            if (!opened.isEmpty()) {
                log.info("Scheduled rule sweep opened {} alerts", opened.size());
            }
            refreshOpenAlertGauge();
        } catch (Exception e) {
            log.error("Scheduled rule sweep failed: {}", e.getMessage(), e);
        }
    }

    private void refreshOpenAlertGauge() {
        metricsConfig.updateOpenAlertCount(lifecycleManager.listActive(Integer.MAX_VALUE).size());
    }
}
