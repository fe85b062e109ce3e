package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = "status", allowGetters = true)
@Schema(description = "A detected condition and its acknowledge/resolve lifecycle")
public class Alert {

    @Schema(description = "Unique alert identifier", example = "daily_token_cost:2026-10-17")
    private String alertId;

    @Schema(description = "Rule id for rule alerts, metric:date key for anomaly alerts", example = "RULE-ERR-RATE")
    private String source;

    @Schema(description = "What produced the alert", example = "RULE")
    private AlertSourceType sourceType;

    @Schema(description = "Rule name or metric name", example = "High error rate")
    private String label;

    @Schema(description = "Metric the alert is about", example = "error_rate")
    private String metric;

    @Schema(description = "Alert severity", example = "CRITICAL")
    private AlertSeverity severity;

    @Schema(description = "Observed metric value", example = "12.5")
    private double currentValue;

    @Schema(description = "Rule threshold or 7-day mean the value was compared against", example = "10.0")
    private double expectedValue;

    @Schema(description = "Percent deviation from the expected value (0 for rule alerts)", example = "25.0")
    private double deviation;

    @Schema(description = "Human-readable description",
            example = "Error Rate is 12.50 (threshold: gt 10.0)")
    private String message;

    @Schema(description = "Channels the alert is intended for; delivery is external")
    @Builder.Default
    private List<NotificationChannel> notificationChannels = new ArrayList<>();

    @Schema(description = "Trigger timestamp in epoch milliseconds", example = "1791072000000")
    private long triggeredAt;

    @Schema(description = "Acknowledge timestamp in epoch milliseconds, null until acknowledged")
    private Long acknowledgedAt;

    @Schema(description = "Actor who acknowledged the alert")
    private String acknowledgedBy;

    @Schema(description = "Resolve timestamp in epoch milliseconds, null while the alert is open")
    private Long resolvedAt;

    @Schema(description = "Actor who resolved the alert")
    private String resolvedBy;

    @JsonIgnore
    public boolean isResolved() {
        return resolvedAt != null;
    }

    @JsonIgnore
    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }

    @JsonProperty("status")
    @Schema(description = "Lifecycle state derived from the timestamps", example = "TRIGGERED")
    public AlertStatus getStatus() {
        if (resolvedAt != null) return AlertStatus.RESOLVED;
        if (acknowledgedAt != null) return AlertStatus.ACKNOWLEDGED;
        return AlertStatus.TRIGGERED;
    }
}
