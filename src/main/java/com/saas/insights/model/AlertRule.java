package com.saas.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Admin-defined threshold condition on a live metric")
public class AlertRule {

    @Schema(description = "Unique rule identifier", example = "RULE-ERR-RATE")
    private String ruleId;

    @Schema(description = "Rule display name", example = "High error rate")
    private String name;

    @Schema(description = "What the rule watches for", example = "Fires when support errors exceed 10 per minute")
    private String description;

    @Schema(description = "Live metric the rule reads", example = "error_rate")
    private MetricKind metric;

    @Schema(description = "Threshold compared against the metric value", example = "10.0")
    private double threshold;

    @Schema(description = "Comparison operator", example = "gt")
    private ComparisonOperator operator;

    @Schema(description = "Severity of alerts raised by this rule. Defaults per metric when omitted", example = "CRITICAL")
    private AlertSeverity severity;

    @Schema(description = "Notification channels recorded on raised alerts")
    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>(List.of(NotificationChannel.IN_APP));

    @Schema(description = "Whether the rule is evaluated", example = "true")
    @Builder.Default
    private boolean enabled = true;

    @Schema(description = "Creation timestamp in epoch milliseconds")
    private long createdAt;

    @Schema(description = "Last update timestamp in epoch milliseconds")
    private long updatedAt;

    @Schema(description = "Admin who created the rule", example = "admin-42")
    private String createdBy;

    public AlertSeverity effectiveSeverity() {
        if (severity != null) return severity;
        return metric != null ? metric.getDefaultSeverity() : AlertSeverity.WARNING;
    }
}
