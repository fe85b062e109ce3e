package com.saas.insights.service;

import com.saas.insights.config.AlertingConfig;
import com.saas.insights.model.AlertRule;
import com.saas.insights.repository.AlertRuleRepository;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * CRUD for alert rules. Starts the rule cache refresh on startup.
 */
@Service
public class AlertRuleService {

    private final AlertRuleRepository ruleRepository;
    private final AlertingConfig alertingConfig;
    private final Clock clock;

    public AlertRuleService(AlertRuleRepository ruleRepository, AlertingConfig alertingConfig, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.alertingConfig = alertingConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        ruleRepository.startCacheRefresh(alertingConfig.getRuleCacheRefreshSeconds());
    }

    public List<AlertRule> getAllRules() {
        return ruleRepository.findAll();
    }

    public AlertRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId);
    }

    /**
     * @throws IllegalArgumentException when name, metric or operator is missing
     */
    public AlertRule createRule(AlertRule rule) {
        validate(rule);
        if (rule.getRuleId() == null || rule.getRuleId().isEmpty()) {
            rule.setRuleId(UUID.randomUUID().toString());
        }
        if (rule.getChannels() == null) {
            rule.setChannels(new ArrayList<>());
        }
        long now = clock.millis();
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        ruleRepository.save(rule);
        return rule;
    }

    /**
     * @return the updated rule, or null when no rule has that id
     */
    public AlertRule updateRule(String ruleId, AlertRule updated) {
        AlertRule existing = ruleRepository.findById(ruleId);
        if (existing == null) {
            return null;
        }

        if (updated.getName() != null) existing.setName(updated.getName());
        if (updated.getDescription() != null) existing.setDescription(updated.getDescription());
        if (updated.getMetric() != null) existing.setMetric(updated.getMetric());
        if (updated.getOperator() != null) existing.setOperator(updated.getOperator());
        if (updated.getSeverity() != null) existing.setSeverity(updated.getSeverity());
        if (updated.getChannels() != null) existing.setChannels(updated.getChannels());
        existing.setThreshold(updated.getThreshold());
        existing.setEnabled(updated.isEnabled());
        existing.setUpdatedAt(clock.millis());

        ruleRepository.save(existing);
        return existing;
    }

    public boolean deleteRule(String ruleId) {
        return ruleRepository.delete(ruleId);
    }

    private static void validate(AlertRule rule) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (rule.getMetric() == null) {
            throw new IllegalArgumentException("metric is required");
        }
        if (rule.getOperator() == null) {
            throw new IllegalArgumentException("operator is required");
        }
    }
}
