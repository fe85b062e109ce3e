package com.saas.insights.controller;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.engine.AlertLifecycleManager;
import com.saas.insights.engine.AlertRuleEvaluator;
import com.saas.insights.model.Alert;
import com.saas.insights.model.MetricsSnapshot;
import com.saas.insights.service.LiveMetricsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert lifecycle: list, acknowledge, resolve, and on-demand rule evaluation")
public class AlertController {

    private static final int MAX_LIMIT = 1000;

    private final AlertLifecycleManager lifecycleManager;
    private final AlertRuleEvaluator ruleEvaluator;
    private final LiveMetricsService liveMetricsService;
    private final AlertingConfig alertingConfig;

    public AlertController(AlertLifecycleManager lifecycleManager,
                           AlertRuleEvaluator ruleEvaluator,
                           LiveMetricsService liveMetricsService,
                           AlertingConfig alertingConfig) {
        this.lifecycleManager = lifecycleManager;
        this.ruleEvaluator = ruleEvaluator;
        this.liveMetricsService = liveMetricsService;
        this.alertingConfig = alertingConfig;
    }

    @Operation(summary = "List active alerts", description = "Unresolved alerts, most recently triggered first.")
    @GetMapping
    public ResponseEntity<?> listActive(
            @Parameter(description = "Maximum alerts to return (1-1000)", example = "50")
            @RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : alertingConfig.getDefaultListLimit();
        if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be between 1 and " + MAX_LIMIT));
        }
        return ResponseEntity.ok(lifecycleManager.listActive(effectiveLimit));
    }

    @Operation(summary = "Get an alert by ID")
    @GetMapping("/{alertId}")
    public ResponseEntity<Alert> getAlert(@PathVariable String alertId) {
        return lifecycleManager.findById(alertId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Acknowledge an alert",
            description = "Idempotent. Rejected with 409 when the alert is already resolved.")
    @PostMapping("/{alertId}/acknowledge")
    public ResponseEntity<?> acknowledge(@PathVariable String alertId,
                                         @RequestBody(required = false) Map<String, String> body) {
        String actorId = actor(body);
        if (actorId == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "actorId is required"));
        }
        return transition(alertId, lifecycleManager.acknowledge(alertId, actorId), "acknowledged");
    }

    @Operation(summary = "Resolve an alert",
            description = "Terminal and idempotent. Frees the rule to raise a new alert.")
    @PostMapping("/{alertId}/resolve")
    public ResponseEntity<?> resolve(@PathVariable String alertId,
                                     @RequestBody(required = false) Map<String, String> body) {
        String actorId = actor(body);
        if (actorId == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "actorId is required"));
        }
        return transition(alertId, lifecycleManager.resolve(alertId, actorId), "resolved");
    }

    @Operation(summary = "Evaluate rules against a supplied snapshot",
            description = "Body maps metric keys (error_rate, churn_risk, token_usage, job_failure_rate, "
                    + "active_users, custom) to values. Missing metrics read as 0.")
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody Map<String, Double> snapshot) {
        MetricsSnapshot parsed;
        try {
            parsed = MetricsSnapshot.fromKeys(snapshot);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(evaluationResponse(ruleEvaluator.evaluateAll(parsed)));
    }

    @Operation(summary = "Evaluate rules against today's stored metric values")
    @PostMapping("/evaluate/live")
    public ResponseEntity<Map<String, Object>> evaluateLive() {
        MetricsSnapshot snapshot = liveMetricsService.currentSnapshot();
        return ResponseEntity.ok(evaluationResponse(ruleEvaluator.evaluateAll(snapshot)));
    }

    private ResponseEntity<?> transition(String alertId, boolean applied, String verb) {
        Optional<Alert> alert = lifecycleManager.findById(alertId);
        if (alert.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!applied) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "alert " + alertId + " could not be " + verb + " in state " + alert.get().getStatus()));
        }
        return ResponseEntity.ok(alert.get());
    }

    private static String actor(Map<String, String> body) {
        if (body == null) return null;
        String actorId = body.get("actorId");
        return actorId == null || actorId.isBlank() ? null : actorId;
    }

    private static Map<String, Object> evaluationResponse(List<Alert> opened) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("openedCount", opened.size());
        response.put("opened", opened);
        return response;
    }
}
