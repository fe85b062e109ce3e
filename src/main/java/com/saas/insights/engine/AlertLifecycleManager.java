package com.saas.insights.engine;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.config.MetricsConfig;
import com.saas.insights.model.Alert;
import com.saas.insights.model.AlertPatch;
import com.saas.insights.model.AlertRule;
import com.saas.insights.model.AlertSourceType;
import com.saas.insights.model.RuleEvaluation;
import com.saas.insights.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates alerts without duplicates and moves them through acknowledge/resolve.
 *
 * <p>Creation is best-effort: writes are retried with linear backoff and a final failure is
 * logged and counted, never thrown. Transitions return false instead of throwing.
 */
@Component
public class AlertLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleManager.class);

    private final AlertStore alertStore;
    private final AlertingConfig alertingConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertLifecycleManager(AlertStore alertStore, AlertingConfig alertingConfig,
                                 MetricsConfig metricsConfig, Clock clock) {
        this.alertStore = alertStore;
        this.alertingConfig = alertingConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Open an alert for a triggered rule unless the rule already has an unresolved one.
     *
     * @return the new alert, or empty when deduplicated or when persistence failed
     */
    public Optional<Alert> openRuleAlert(AlertRule rule, RuleEvaluation evaluation) {
        Alert alert = Alert.builder()
                .alertId(UUID.randomUUID().toString())
                .source(rule.getRuleId())
                .sourceType(AlertSourceType.RULE)
                .label(rule.getName())
                .metric(rule.getMetric().getKey())
                .severity(rule.effectiveSeverity())
                .currentValue(evaluation.value())
                .expectedValue(rule.getThreshold())
                .deviation(0.0)
                .message(evaluation.message())
                .notificationChannels(new ArrayList<>(rule.getChannels()))
                .triggeredAt(clock.millis())
                .build();

        Optional<Boolean> created = persistWithRetry(AlertSourceType.RULE,
                () -> alertStore.createIfNoneUnresolved(alert));
        if (created.isEmpty()) {
            return Optional.empty();
        }
        if (!created.get()) {
            metricsConfig.recordAlertDeduplicated(AlertSourceType.RULE.name());
            log.debug("Rule {} already has an open alert, skipping", rule.getRuleId());
            return Optional.empty();
        }

        metricsConfig.recordAlertCreated(AlertSourceType.RULE.name());
        log.info("Alert {} opened for rule {} ({}): {}",
                alert.getAlertId(), rule.getRuleId(), alert.getSeverity(), alert.getMessage());
        return Optional.of(alert);
    }

    /**
     * Store an anomaly alert under its deterministic id. A second call for the same metric and
     * day returns the alert stored by the first.
     */
    public Alert recordAnomalyAlert(Alert alert) {
        Optional<Boolean> created = persistWithRetry(AlertSourceType.ANOMALY,
                () -> alertStore.createIfAbsent(alert));
        if (created.isEmpty()) {
            return alert;
        }
        if (created.get()) {
            metricsConfig.recordAlertCreated(AlertSourceType.ANOMALY.name());
            log.info("Anomaly alert {} recorded: {}", alert.getAlertId(), alert.getMessage());
            return alert;
        }
        metricsConfig.recordAlertDeduplicated(AlertSourceType.ANOMALY.name());
        return alertStore.findById(alert.getAlertId()).orElse(alert);
    }

    /**
     * @return true when the alert is (now or already) acknowledged; false when it is unknown,
     *         resolved, or the write failed
     */
    public boolean acknowledge(String alertId, String actorId) {
        try {
            Optional<Alert> existing = alertStore.findById(alertId);
            if (existing.isEmpty()) {
                metricsConfig.recordAlertTransition("acknowledge", "not_found");
                return false;
            }
            Alert alert = existing.get();
            if (alert.isResolved()) {
                metricsConfig.recordAlertTransition("acknowledge", "rejected");
                return false;
            }
            if (alert.isAcknowledged()) {
                return true;
            }
            boolean updated = alertStore.update(alertId, AlertPatch.acknowledge(clock.millis(), actorId));
            metricsConfig.recordAlertTransition("acknowledge", updated ? "ok" : "not_found");
            if (updated) {
                log.info("Alert {} acknowledged by {}", alertId, actorId);
            }
            return updated;
        } catch (RuntimeException e) {
            metricsConfig.recordAlertTransition("acknowledge", "error");
            log.error("Failed to acknowledge alert {}: {}", alertId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Resolve is terminal. Resolving an already resolved alert is a no-op that returns true.
     */
    public boolean resolve(String alertId, String actorId) {
        try {
            Optional<Alert> existing = alertStore.findById(alertId);
            if (existing.isEmpty()) {
                metricsConfig.recordAlertTransition("resolve", "not_found");
                return false;
            }
            if (existing.get().isResolved()) {
                return true;
            }
            boolean updated = alertStore.update(alertId, AlertPatch.resolve(clock.millis(), actorId));
            metricsConfig.recordAlertTransition("resolve", updated ? "ok" : "not_found");
            if (updated) {
                log.info("Alert {} resolved by {}", alertId, actorId);
            }
            return updated;
        } catch (RuntimeException e) {
            metricsConfig.recordAlertTransition("resolve", "error");
            log.error("Failed to resolve alert {}: {}", alertId, e.getMessage(), e);
            return false;
        }
    }

    public List<Alert> listActive(int limit) {
        return alertStore.listUnresolved(limit);
    }

    public Optional<Alert> findById(String alertId) {
        return alertStore.findById(alertId);
    }

    private <T> Optional<T> persistWithRetry(AlertSourceType sourceType, Supplier<T> write) {
        int maxAttempts = Math.max(1, alertingConfig.getPersistMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return Optional.of(write.get());
            } catch (RuntimeException e) {
                log.warn("Alert write failed (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !sleepBeforeRetry(attempt)) {
                    break;
                }
            }
        }
        metricsConfig.recordAlertPersistFailure(sourceType.name());
        log.error("Giving up on {} alert write after {} attempts", sourceType, maxAttempts);
        return Optional.empty();
    }

    private boolean sleepBeforeRetry(int attempt) {
        long backoff = alertingConfig.getPersistBackoffMs() * attempt;
        if (backoff <= 0) {
            return true;
        }
        try {
            Thread.sleep(backoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
