package com.saas.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saas.insights.config.AerospikeConfig;
import com.saas.insights.model.AlertRule;
import com.saas.insights.model.AlertSeverity;
import com.saas.insights.model.ComparisonOperator;
import com.saas.insights.model.MetricKind;
import com.saas.insights.model.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

@Repository
public class AlertRuleRepository implements AlertRuleSource {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    // Rules as of the last refresh; evaluation reads only from here.
    private final AtomicReference<List<AlertRule>> cachedRules = new AtomicReference<>(new CopyOnWriteArrayList<>());

    public AlertRuleRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Start periodic cache refresh on a daemon thread.
     */
    public void startCacheRefresh(int intervalSeconds) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "alert-rule-cache-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refreshCache, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public void refreshCache() {
        try {
            List<AlertRule> allRules = scanAllRules();
            cachedRules.set(new CopyOnWriteArrayList<>(allRules));
            log.debug("Alert rule cache refreshed, {} rules loaded", allRules.size());
        } catch (Exception e) {
            log.error("Failed to refresh alert rule cache", e);
        }
    }

    @Override
    public List<AlertRule> listEnabledRules() {
        return cachedRules.get().stream()
                .filter(AlertRule::isEnabled)
                .toList();
    }

    public List<AlertRule> findAll() {
        return scanAllRules();
    }

    public AlertRule findById(String ruleId) {
        Record record = client.get(readPolicy, key(ruleId));
        if (record == null) return null;
        return mapRecordToRule(ruleId, record);
    }

    public void save(AlertRule rule) {
        AlertSeverity severity = rule.getSeverity();
        client.put(writePolicy, key(rule.getRuleId()),
                new Bin("ruleId", rule.getRuleId()),
                new Bin("name", rule.getName()),
                new Bin("description", rule.getDescription()),
                new Bin("metric", rule.getMetric().getKey()),
                new Bin("threshold", rule.getThreshold()),
                new Bin("operator", rule.getOperator().getKey()),
                new Bin("severity", severity != null ? severity.name() : null),
                new Bin("channels", serializeChannels(rule.getChannels())),
                new Bin("enabled", rule.isEnabled()),
                new Bin("createdAt", rule.getCreatedAt()),
                new Bin("updatedAt", rule.getUpdatedAt()),
                new Bin("createdBy", rule.getCreatedBy()));

        refreshCache();
    }

    public boolean delete(String ruleId) {
        boolean deleted = client.delete(writePolicy, key(ruleId));
        if (deleted) {
            refreshCache();
        }
        return deleted;
    }

    private List<AlertRule> scanAllRules() {
        List<AlertRule> rules = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERT_RULES,
                (key, record) -> {
                    try {
                        String ruleId = record.getString("ruleId");
                        if (ruleId != null) {
                            rules.add(mapRecordToRule(ruleId, record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize alert rule record: {}", e.getMessage());
                    }
                });
        return new ArrayList<>(rules);
    }

    private AlertRule mapRecordToRule(String ruleId, Record record) {
        String severity = record.getString("severity");
        return AlertRule.builder()
                .ruleId(ruleId)
                .name(record.getString("name"))
                .description(record.getString("description"))
                .metric(MetricKind.fromKey(record.getString("metric")))
                .threshold(record.getDouble("threshold"))
                .operator(ComparisonOperator.fromKey(record.getString("operator")))
                .severity(severity != null ? AlertSeverity.valueOf(severity) : null)
                .channels(deserializeChannels(record.getString("channels")))
                .enabled(record.getBoolean("enabled"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .createdBy(record.getString("createdBy"))
                .build();
    }

    private String serializeChannels(List<NotificationChannel> channels) {
        try {
            return objectMapper.writeValueAsString(channels == null ? List.of() : channels);
        } catch (Exception e) {
            return "[]";
        }
    }

    private List<NotificationChannel> deserializeChannels(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<NotificationChannel>>() {});
        } catch (Exception e) {
            return new ArrayList<>();
        }
    }

    private Key key(String ruleId) {
        return new Key(namespace, AerospikeConfig.SET_ALERT_RULES, ruleId);
    }
}
