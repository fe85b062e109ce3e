package com.saas.insights.engine;

import com.saas.insights.config.MetricsConfig;
import com.saas.insights.model.Alert;
import com.saas.insights.model.AlertRule;
import com.saas.insights.model.MetricsSnapshot;
import com.saas.insights.model.RuleEvaluation;
import com.saas.insights.repository.AlertRuleSource;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates enabled alert rules against a metrics snapshot.
 */
@Component
public class AlertRuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleEvaluator.class);

    private final AlertRuleSource ruleSource;
    private final AlertLifecycleManager lifecycleManager;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AlertRuleEvaluator(AlertRuleSource ruleSource, AlertLifecycleManager lifecycleManager,
                              Tracer tracer, MetricsConfig metricsConfig) {
        this.ruleSource = ruleSource;
        this.lifecycleManager = lifecycleManager;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Apply one rule. Comparison is exact, {@code eq} included.
     */
    public RuleEvaluation evaluate(AlertRule rule, MetricsSnapshot snapshot) {
        double value = snapshot.valueOf(rule.getMetric());
        boolean triggered = rule.getOperator().test(value, rule.getThreshold());
        if (!triggered) {
            return new RuleEvaluation(false, value, "");
        }
        String message = String.format(Locale.ROOT, "%s is %.2f (threshold: %s %s)",
                rule.getMetric().getDisplayName(), value, rule.getOperator().getKey(), rule.getThreshold());
        return new RuleEvaluation(true, value, message);
    }

    /**
     * Evaluate every enabled rule and open an alert for each triggered rule that has no
     * unresolved alert yet.
     *
     * @return alerts opened by this call
     */
    @Observed(name = "alert_rules.evaluate_all", contextualName = "evaluate-alert-rules")
    public List<Alert> evaluateAll(MetricsSnapshot snapshot) {
        List<AlertRule> rules = ruleSource.listEnabledRules();
        List<Alert> opened = new ArrayList<>();

        for (AlertRule rule : rules) {
            Span ruleSpan = tracer.nextSpan()
                    .name("alert_rule.evaluate")
                    .tag("rule.id", rule.getRuleId())
                    .tag("rule.metric", String.valueOf(rule.getMetric()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                RuleEvaluation evaluation = evaluate(rule, snapshot);
                ruleSpan.tag("rule.triggered", String.valueOf(evaluation.triggered()));

                if (evaluation.triggered()) {
                    metricsConfig.recordRuleTriggered(rule.getMetric().getKey());
                    log.debug("Rule {} triggered: {}", rule.getRuleId(), evaluation.message());
                    lifecycleManager.openRuleAlert(rule, evaluation).ifPresent(opened::add);
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating alert rule {}: {}", rule.getRuleId(), e.getMessage(), e);
            } finally {
                ruleSpan.end();
            }
        }

        return opened;
    }
}
