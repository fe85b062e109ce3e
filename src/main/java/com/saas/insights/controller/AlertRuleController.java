package com.saas.insights.controller;

import com.saas.insights.model.AlertRule;
import com.saas.insights.service.AlertRuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/alert-rules")
@Tag(name = "Alert Rules", description = "Manage threshold rules over live metrics")
public class AlertRuleController {

    private final AlertRuleService ruleService;

    public AlertRuleController(AlertRuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all alert rules")
    @GetMapping
    public ResponseEntity<List<AlertRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<AlertRule> getRule(
            @Parameter(description = "Rule ID", example = "RULE-ERR-RATE")
            @PathVariable String ruleId) {
        AlertRule rule = ruleService.getRule(ruleId);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }

    @Operation(summary = "Create an alert rule",
            description = "name, metric and operator are required. Severity defaults per metric when omitted.")
    @PostMapping
    public ResponseEntity<?> createRule(@RequestBody AlertRule rule) {
        try {
            return ResponseEntity.ok(ruleService.createRule(rule));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Update an alert rule")
    @PutMapping("/{ruleId}")
    public ResponseEntity<AlertRule> updateRule(
            @Parameter(description = "Rule ID", example = "RULE-ERR-RATE")
            @PathVariable String ruleId,
            @RequestBody AlertRule updated) {
        AlertRule result = ruleService.updateRule(ruleId, updated);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Delete an alert rule")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @Parameter(description = "Rule ID", example = "RULE-ERR-RATE")
            @PathVariable String ruleId) {
        if (!ruleService.deleteRule(ruleId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
