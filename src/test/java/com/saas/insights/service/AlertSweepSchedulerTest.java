package com.saas.insights.service;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.config.MetricsConfig;
import com.saas.insights.engine.AlertLifecycleManager;
import com.saas.insights.engine.AlertRuleEvaluator;
import com.saas.insights.engine.AnomalyDetector;
import com.saas.insights.model.AnomalyReport;
import com.saas.insights.model.MetricsSnapshot;
import com.saas.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertSweepSchedulerTest {

    @Mock
    private AnomalyDetector anomalyDetector;

    @Mock
    private AlertRuleEvaluator ruleEvaluator;

    @Mock
    private AlertLifecycleManager lifecycleManager;

    @Mock
    private LiveMetricsService liveMetricsService;

    @Mock
    private MetricsConfig metricsConfig;

    private AlertingConfig alertingConfig;
    private AlertSweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        alertingConfig = new AlertingConfig();
        scheduler = new AlertSweepScheduler(anomalyDetector, ruleEvaluator, lifecycleManager,
                liveMetricsService, alertingConfig, metricsConfig, TestDataFactory.fixedClock());
    }

    @Test
    void sweeps_disabledByDefault() {
        scheduler.sweepAnomalies();
        scheduler.sweepRules();

        verifyNoInteractions(anomalyDetector, ruleEvaluator, liveMetricsService);
    }

    @Test
    void sweepAnomalies_checksYesterday() {
        alertingConfig.getSweep().setAnomalyEnabled(true);
        when(anomalyDetector.detectAnomalies(TestDataFactory.TODAY.minusDays(1)))
                .thenReturn(AnomalyReport.of(TestDataFactory.TODAY.minusDays(1), List.of()));
        when(lifecycleManager.listActive(Integer.MAX_VALUE))
                .thenReturn(List.of(TestDataFactory.createRuleAlert("a1", "R1")));

        scheduler.sweepAnomalies();

        verify(metricsConfig).updateOpenAlertCount(1);
    }

    @Test
    void sweepRules_evaluatesLiveSnapshot() {
        alertingConfig.getSweep().setRulesEnabled(true);
        MetricsSnapshot snapshot = MetricsSnapshot.fromKeys(Map.of("error_rate", 2.0));
        when(liveMetricsService.currentSnapshot()).thenReturn(snapshot);
        when(ruleEvaluator.evaluateAll(snapshot)).thenReturn(List.of());

        scheduler.sweepRules();

        verify(ruleEvaluator).evaluateAll(snapshot);
        verify(metricsConfig).updateOpenAlertCount(0);
    }

    @Test
    void sweepAnomalies_failureDoesNotEscape() {
        alertingConfig.getSweep().setAnomalyEnabled(true);
        when(anomalyDetector.detectAnomalies(any())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> scheduler.sweepAnomalies()).doesNotThrowAnyException();
    }
}
