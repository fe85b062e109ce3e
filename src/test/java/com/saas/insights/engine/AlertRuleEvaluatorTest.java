package com.saas.insights.engine;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.config.MetricsConfig;
import com.saas.insights.model.Alert;
import com.saas.insights.model.AlertRule;
import com.saas.insights.model.AlertSeverity;
import com.saas.insights.model.ComparisonOperator;
import com.saas.insights.model.MetricKind;
import com.saas.insights.model.MetricsSnapshot;
import com.saas.insights.model.RuleEvaluation;
import com.saas.insights.repository.AlertRuleSource;
import com.saas.insights.testutil.InMemoryAlertStore;
import com.saas.insights.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AlertRuleEvaluatorTest {

    private final List<AlertRule> rules = new ArrayList<>();
    private InMemoryAlertStore alertStore;
    private AlertLifecycleManager lifecycleManager;
    private AlertRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        alertStore = new InMemoryAlertStore();
        MetricsConfig metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        AlertingConfig alertingConfig = new AlertingConfig();
        alertingConfig.setPersistBackoffMs(0);
        lifecycleManager = new AlertLifecycleManager(alertStore, alertingConfig, metricsConfig, TestDataFactory.fixedClock());
        AlertRuleSource source = () -> List.copyOf(rules);
        evaluator = new AlertRuleEvaluator(source, lifecycleManager, Tracer.NOOP, metricsConfig);
    }

    private static MetricsSnapshot snapshot(MetricKind kind, double value) {
        return MetricsSnapshot.of(Map.of(kind, value));
    }

    @Test
    void evaluate_gt_isStrict() {
        AlertRule rule = TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 10.0);

        assertThat(evaluator.evaluate(rule, snapshot(MetricKind.ERROR_RATE, 10.0)).triggered()).isFalse();
        assertThat(evaluator.evaluate(rule, snapshot(MetricKind.ERROR_RATE, 10.01)).triggered()).isTrue();
    }

    @Test
    void evaluate_gte_includesThreshold() {
        AlertRule rule = TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GTE, 10.0);

        assertThat(evaluator.evaluate(rule, snapshot(MetricKind.ERROR_RATE, 10.0)).triggered()).isTrue();
    }

    @Test
    void evaluate_lt_and_lte() {
        AlertRule lt = TestDataFactory.createAlertRule("R1", MetricKind.ACTIVE_USERS, ComparisonOperator.LT, 100.0);
        AlertRule lte = TestDataFactory.createAlertRule("R2", MetricKind.ACTIVE_USERS, ComparisonOperator.LTE, 100.0);

        assertThat(evaluator.evaluate(lt, snapshot(MetricKind.ACTIVE_USERS, 100.0)).triggered()).isFalse();
        assertThat(evaluator.evaluate(lte, snapshot(MetricKind.ACTIVE_USERS, 100.0)).triggered()).isTrue();
        assertThat(evaluator.evaluate(lt, snapshot(MetricKind.ACTIVE_USERS, 99.0)).triggered()).isTrue();
    }

    @Test
    void evaluate_eq_isExact() {
        AlertRule rule = TestDataFactory.createAlertRule("R1", MetricKind.CUSTOM, ComparisonOperator.EQ, 0.3);

        assertThat(evaluator.evaluate(rule, snapshot(MetricKind.CUSTOM, 0.3)).triggered()).isTrue();
        assertThat(evaluator.evaluate(rule, snapshot(MetricKind.CUSTOM, 0.1 + 0.2)).triggered()).isFalse();
    }

    @Test
    void evaluate_missingMetric_readsAsZero() {
        AlertRule rule = TestDataFactory.createAlertRule("R1", MetricKind.TOKEN_USAGE, ComparisonOperator.LT, 1.0);

        RuleEvaluation evaluation = evaluator.evaluate(rule, MetricsSnapshot.empty());

        assertThat(evaluation.triggered()).isTrue();
        assertThat(evaluation.value()).isEqualTo(0.0);
    }

    @Test
    void evaluate_triggered_formatsMessage() {
        AlertRule rule = TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 10.0);

        RuleEvaluation evaluation = evaluator.evaluate(rule, snapshot(MetricKind.ERROR_RATE, 12.5));

        assertThat(evaluation.message()).isEqualTo("Error Rate is 12.50 (threshold: gt 10.0)");
    }

    @Test
    void evaluate_notTriggered_emptyMessage() {
        AlertRule rule = TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 10.0);

        assertThat(evaluator.evaluate(rule, snapshot(MetricKind.ERROR_RATE, 1.0)).message()).isEmpty();
    }

    @Test
    void evaluateAll_repeatedTrigger_opensSingleAlert() {
        rules.add(TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 10.0));
        MetricsSnapshot high = snapshot(MetricKind.ERROR_RATE, 25.0);

        List<Alert> first = evaluator.evaluateAll(high);
        List<Alert> second = evaluator.evaluateAll(high);

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(alertStore.listUnresolved(10)).hasSize(1);
    }

    @Test
    void evaluateAll_concurrentSweeps_opensSingleAlert() throws Exception {
        rules.add(TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 10.0));
        MetricsSnapshot high = snapshot(MetricKind.ERROR_RATE, 25.0);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<Alert>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<List<Alert>> task = () -> {
                    start.await();
                    return evaluator.evaluateAll(high);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int opened = 0;
            for (Future<List<Alert>> future : futures) {
                opened += future.get(10, TimeUnit.SECONDS).size();
            }
            assertThat(opened).isEqualTo(1);
            assertThat(alertStore.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void evaluateAll_afterResolve_opensNewAlert() {
        rules.add(TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 10.0));
        MetricsSnapshot high = snapshot(MetricKind.ERROR_RATE, 25.0);

        Alert first = evaluator.evaluateAll(high).get(0);
        assertThat(lifecycleManager.resolve(first.getAlertId(), "ops-1")).isTrue();
        List<Alert> reopened = evaluator.evaluateAll(high);

        assertThat(reopened).hasSize(1);
        assertThat(reopened.get(0).getAlertId()).isNotEqualTo(first.getAlertId());
        assertThat(alertStore.size()).isEqualTo(2);
    }

    @Test
    void evaluateAll_severityFromRuleOrMetricDefault() {
        AlertRule errorRate = TestDataFactory.createAlertRule("R-ERR", MetricKind.ERROR_RATE, ComparisonOperator.GT, 1.0);
        AlertRule tokens = TestDataFactory.createAlertRule("R-TOK", MetricKind.TOKEN_USAGE, ComparisonOperator.GT, 1.0);
        AlertRule overridden = TestDataFactory.createAlertRule("R-JOB", MetricKind.JOB_FAILURE_RATE, ComparisonOperator.GT, 1.0);
        overridden.setSeverity(AlertSeverity.WARNING);
        rules.addAll(List.of(errorRate, tokens, overridden));

        MetricsSnapshot snapshot = MetricsSnapshot.of(Map.of(
                MetricKind.ERROR_RATE, 5.0, MetricKind.TOKEN_USAGE, 5.0, MetricKind.JOB_FAILURE_RATE, 5.0));
        List<Alert> opened = evaluator.evaluateAll(snapshot);

        assertThat(opened).hasSize(3);
        assertThat(opened).filteredOn(a -> a.getSource().equals("R-ERR"))
                .singleElement().extracting(Alert::getSeverity).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(opened).filteredOn(a -> a.getSource().equals("R-TOK"))
                .singleElement().extracting(Alert::getSeverity).isEqualTo(AlertSeverity.WARNING);
        assertThat(opened).filteredOn(a -> a.getSource().equals("R-JOB"))
                .singleElement().extracting(Alert::getSeverity).isEqualTo(AlertSeverity.WARNING);
    }

    @Test
    void evaluateAll_brokenRule_doesNotBlockOthers() {
        AlertRule broken = TestDataFactory.createAlertRule("R-BAD", MetricKind.ERROR_RATE, null, 1.0);
        AlertRule healthy = TestDataFactory.createAlertRule("R-OK", MetricKind.ERROR_RATE, ComparisonOperator.GT, 1.0);
        rules.addAll(List.of(broken, healthy));

        List<Alert> opened = evaluator.evaluateAll(snapshot(MetricKind.ERROR_RATE, 5.0));

        assertThat(opened).extracting(Alert::getSource).containsExactly("R-OK");
    }

    @Test
    void evaluateAll_alertCarriesRuleDetails() {
        AlertRule rule = TestDataFactory.createAlertRule("R1", MetricKind.ERROR_RATE, ComparisonOperator.GT, 10.0);
        rules.add(rule);

        Alert alert = evaluator.evaluateAll(snapshot(MetricKind.ERROR_RATE, 12.5)).get(0);

        assertThat(alert.getLabel()).isEqualTo(rule.getName());
        assertThat(alert.getMetric()).isEqualTo("error_rate");
        assertThat(alert.getCurrentValue()).isEqualTo(12.5);
        assertThat(alert.getExpectedValue()).isEqualTo(10.0);
        assertThat(alert.getNotificationChannels()).isEqualTo(rule.getChannels());
        assertThat(alert.getTriggeredAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
    }
}
