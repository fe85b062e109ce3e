package com.saas.insights.config;

import com.saas.insights.model.MetricKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "insights.alerting")
public class AlertingConfig {

    // Attempts per alert write before the failure is logged and dropped.
    private int persistMaxAttempts = 3;

    // Backoff between attempts, multiplied by the attempt number.
    private long persistBackoffMs = 200;

    private int defaultListLimit = 50;

    // How often (in seconds) to refresh the in-memory rule cache from Aerospike.
    private int ruleCacheRefreshSeconds = 60;

    // Daily sample metric read for each live metric kind when building a snapshot.
    private Map<MetricKind, String> snapshotMetrics = defaultSnapshotMetrics();

    private Sweep sweep = new Sweep();

    @Data
    public static class Sweep {
        private boolean anomalyEnabled = false;
        private String anomalyCron = "0 15 0 * * *";
        private boolean rulesEnabled = false;
        private int ruleIntervalSeconds = 300;
    }

    private static Map<MetricKind, String> defaultSnapshotMetrics() {
        Map<MetricKind, String> metrics = new EnumMap<>(MetricKind.class);
        metrics.put(MetricKind.ERROR_RATE, "support_errors");
        metrics.put(MetricKind.TOKEN_USAGE, "tokens_used");
        metrics.put(MetricKind.JOB_FAILURE_RATE, "job_failure_rate");
        metrics.put(MetricKind.ACTIVE_USERS, "active_users");
        return metrics;
    }
}
