package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of live metrics an alert rule can watch.
 */
public enum MetricKind {
    ERROR_RATE("error_rate", "Error Rate", AlertSeverity.CRITICAL),
    CHURN_RISK("churn_risk", "Churn Risk", AlertSeverity.WARNING),
    TOKEN_USAGE("token_usage", "Token Usage", AlertSeverity.WARNING),
    JOB_FAILURE_RATE("job_failure_rate", "Job Failure Rate", AlertSeverity.CRITICAL),
    ACTIVE_USERS("active_users", "Active Users", AlertSeverity.WARNING),
    CUSTOM("custom", "Custom Metric", AlertSeverity.WARNING);

    private final String key;
    private final String displayName;
    private final AlertSeverity defaultSeverity;

    MetricKind(String key, String displayName, AlertSeverity defaultSeverity) {
        this.key = key;
        this.displayName = displayName;
        this.defaultSeverity = defaultSeverity;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Severity used for rules that do not configure one.
     */
    public AlertSeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    @JsonCreator
    public static MetricKind fromKey(String value) {
        for (MetricKind kind : values()) {
            if (kind.key.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown metric kind: " + value);
    }
}
