package com.saas.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saas.insights.config.AerospikeConfig;
import com.saas.insights.model.Alert;
import com.saas.insights.model.AlertPatch;
import com.saas.insights.model.AlertSeverity;
import com.saas.insights.model.AlertSourceType;
import com.saas.insights.model.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Alerts live in the "alerts" set keyed by alertId.
 *
 * <p>At most one unresolved rule alert may exist per source. This is enforced with a guard
 * record in "open_alert_guards" keyed by the source and written CREATE_ONLY: whoever creates
 * the guard owns the open slot. Resolving the alert deletes the guard. A guard whose holder is
 * resolved, or missing for longer than {@code staleGuardMs}, is treated as stale and reclaimed
 * once.
 *
 * <p>Guards are only ever deleted with a generation check against the copy that was read, so a
 * guard re-claimed by a concurrent writer is never removed. A guard is released after a failed
 * alert write only once a read confirms the alert is absent.
 */
@Repository
public class AlertRepository implements AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private static final String BIN_GUARD_ALERT_ID = "alertId";
    private static final String BIN_GUARD_CLAIMED_AT = "claimedAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final WritePolicy createOnlyPolicy;
    private final FallbackExecutor fallbackExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long staleGuardMs;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy,
                           FallbackExecutor fallbackExecutor,
                           Clock clock,
                           @Value("${insights.alerting.stale-guard-ms:60000}") long staleGuardMs) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.fallbackExecutor = fallbackExecutor;
        this.clock = clock;
        this.staleGuardMs = staleGuardMs;
        this.objectMapper = new ObjectMapper();

        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        return fallbackExecutor.execute("alert-by-id",
                () -> readAlert(alertId),
                () -> scanAlerts().stream().filter(a -> alertId.equals(a.getAlertId())).findFirst(),
                Optional.empty());
    }

    @Override
    public Optional<Alert> findUnresolvedBySource(String source) {
        return fallbackExecutor.execute("alert-open-by-source",
                () -> {
                    Record guard = client.get(readPolicy, guardKey(source));
                    if (guard == null) return Optional.<Alert>empty();
                    return readAlert(guard.getString(BIN_GUARD_ALERT_ID)).filter(a -> !a.isResolved());
                },
                () -> scanAlerts().stream()
                        .filter(a -> source.equals(a.getSource()) && !a.isResolved())
                        .findFirst(),
                Optional.empty());
    }

    @Override
    public boolean createIfNoneUnresolved(Alert alert) {
        String alertId = alert.getAlertId();
        Key guardKey = guardKey(alert.getSource());

        if (!claimGuard(guardKey, alertId)) {
            Record guard = client.get(readPolicy, guardKey);
            if (guard != null && alertId.equals(guard.getString(BIN_GUARD_ALERT_ID))) {
                // Claimed by an earlier attempt for this same alert whose outcome was unknown.
                log.debug("Guard for source {} already held by alert {}", alert.getSource(), alertId);
            } else if (!reclaimIfStale(guardKey, guard, alertId)) {
                return false;
            }
        }

        try {
            client.put(createOnlyPolicy, alertKey(alertId), toBins(alert));
        } catch (RuntimeException e) {
            if (e instanceof AerospikeException ae && ae.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                // An earlier attempt timed out after the write landed.
                log.info("Alert {} was already stored by a previous attempt", alertId);
                return true;
            }
            releaseIfAlertAbsent(guardKey, alertId);
            throw e;
        }
        return true;
    }

    @Override
    public boolean createIfAbsent(Alert alert) {
        try {
            client.put(createOnlyPolicy, alertKey(alert.getAlertId()), toBins(alert));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean update(String alertId, AlertPatch patch) {
        Optional<Alert> existing = readAlert(alertId);
        if (existing.isEmpty()) {
            return false;
        }

        List<Bin> bins = new ArrayList<>();
        if (patch.getAcknowledgedAt() != null) {
            bins.add(new Bin("acknowledgedAt", patch.getAcknowledgedAt().longValue()));
            bins.add(new Bin("acknowledgedBy", patch.getAcknowledgedBy()));
        }
        if (patch.getResolvedAt() != null) {
            bins.add(new Bin("resolvedAt", patch.getResolvedAt().longValue()));
            bins.add(new Bin("resolvedBy", patch.getResolvedBy()));
        }
        if (bins.isEmpty()) {
            return true;
        }
        client.put(writePolicy, alertKey(alertId), bins.toArray(new Bin[0]));

        Alert alert = existing.get();
        if (patch.isResolving() && alert.getSourceType() == AlertSourceType.RULE) {
            try {
                releaseGuard(guardKey(alert.getSource()), alertId);
            } catch (RuntimeException e) {
                // A guard whose holder is resolved is reclaimed as stale on the next claim.
                log.warn("Alert {} resolved but its guard for source {} was not released: {}",
                        alertId, alert.getSource(), e.getMessage());
            }
        }
        return true;
    }

    @Override
    public List<Alert> listUnresolved(int limit) {
        return fallbackExecutor.execute("alert-list-unresolved",
                () -> scanAlerts().stream()
                        .filter(a -> !a.isResolved())
                        .sorted(Comparator.comparingLong(Alert::getTriggeredAt).reversed())
                        .limit(Math.max(0, limit))
                        .toList(),
                null,
                List.of());
    }

    private boolean claimGuard(Key guardKey, String alertId) {
        try {
            client.put(createOnlyPolicy, guardKey,
                    new Bin(BIN_GUARD_ALERT_ID, alertId),
                    new Bin(BIN_GUARD_CLAIMED_AT, clock.millis()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    private boolean reclaimIfStale(Key guardKey, Record guard, String alertId) {
        if (guard == null) {
            // Released between the claim attempt and the read.
            return claimGuard(guardKey, alertId);
        }
        if (!isStale(guard)) {
            return false;
        }
        log.warn("Reclaiming stale open-alert guard {} held by {}", guardKey.userKey, guard.getString(BIN_GUARD_ALERT_ID));
        if (!deleteGuardIfUnchanged(guardKey, guard)) {
            return false;
        }
        return claimGuard(guardKey, alertId);
    }

    private boolean isStale(Record guard) {
        Optional<Alert> holder = readAlert(guard.getString(BIN_GUARD_ALERT_ID));
        if (holder.isPresent()) {
            return holder.get().isResolved();
        }
        // Holder may still be mid-write; only reclaim once the claim is old.
        long claimedAt = guard.getLong(BIN_GUARD_CLAIMED_AT);
        return clock.millis() - claimedAt > staleGuardMs;
    }

    /**
     * @return false when the guard changed since {@code seen} was read
     */
    private boolean deleteGuardIfUnchanged(Key guardKey, Record seen) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = seen.generation;
        try {
            client.delete(policy, guardKey);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Guard {} changed since it was read, leaving it", guardKey.userKey);
                return false;
            }
            throw e;
        }
    }

    private void releaseGuard(Key guardKey, String alertId) {
        Record guard = client.get(readPolicy, guardKey);
        if (guard != null && alertId.equals(guard.getString(BIN_GUARD_ALERT_ID))) {
            deleteGuardIfUnchanged(guardKey, guard);
        }
    }

    private void releaseIfAlertAbsent(Key guardKey, String alertId) {
        try {
            if (client.get(readPolicy, alertKey(alertId)) != null) {
                return;
            }
            releaseGuard(guardKey, alertId);
        } catch (RuntimeException e) {
            log.warn("Could not confirm alert {} after a failed write, keeping its guard: {}", alertId, e.getMessage());
        }
    }

    private Optional<Alert> readAlert(String alertId) {
        if (alertId == null) return Optional.empty();
        Record record = client.get(readPolicy, alertKey(alertId));
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(alertId, record));
    }

    private List<Alert> scanAlerts() {
        List<Alert> alerts = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                (key, record) -> {
                    try {
                        String alertId = record.getString("alertId");
                        if (alertId != null) {
                            alerts.add(mapRecord(alertId, record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize alert record: {}", e.getMessage());
                    }
                });
        return new ArrayList<>(alerts);
    }

    private Bin[] toBins(Alert alert) {
        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("alertId", alert.getAlertId()));
        bins.add(new Bin("source", alert.getSource()));
        bins.add(new Bin("sourceType", alert.getSourceType().name()));
        bins.add(new Bin("label", alert.getLabel()));
        bins.add(new Bin("metric", alert.getMetric()));
        bins.add(new Bin("severity", alert.getSeverity().name()));
        bins.add(new Bin("currentValue", alert.getCurrentValue()));
        bins.add(new Bin("expectedValue", alert.getExpectedValue()));
        bins.add(new Bin("deviation", alert.getDeviation()));
        bins.add(new Bin("message", alert.getMessage()));
        bins.add(new Bin("channels", serializeChannels(alert.getNotificationChannels())));
        bins.add(new Bin("triggeredAt", alert.getTriggeredAt()));
        if (alert.getAcknowledgedAt() != null) {
            bins.add(new Bin("acknowledgedAt", alert.getAcknowledgedAt().longValue()));
            bins.add(new Bin("acknowledgedBy", alert.getAcknowledgedBy()));
        }
        if (alert.getResolvedAt() != null) {
            bins.add(new Bin("resolvedAt", alert.getResolvedAt().longValue()));
            bins.add(new Bin("resolvedBy", alert.getResolvedBy()));
        }
        return bins.toArray(new Bin[0]);
    }

    private Alert mapRecord(String alertId, Record record) {
        return Alert.builder()
                .alertId(alertId)
                .source(record.getString("source"))
                .sourceType(AlertSourceType.valueOf(record.getString("sourceType")))
                .label(record.getString("label"))
                .metric(record.getString("metric"))
                .severity(AlertSeverity.valueOf(record.getString("severity")))
                .currentValue(record.getDouble("currentValue"))
                .expectedValue(record.getDouble("expectedValue"))
                .deviation(record.getDouble("deviation"))
                .message(record.getString("message"))
                .notificationChannels(deserializeChannels(record.getString("channels")))
                .triggeredAt(record.getLong("triggeredAt"))
                .acknowledgedAt(nullableLong(record, "acknowledgedAt"))
                .acknowledgedBy(record.getString("acknowledgedBy"))
                .resolvedAt(nullableLong(record, "resolvedAt"))
                .resolvedBy(record.getString("resolvedBy"))
                .build();
    }

    private static Long nullableLong(Record record, String bin) {
        Object v = record.getValue(bin);
        if (v instanceof Number n) return n.longValue();
        return null;
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
            log.warn("Unreadable channel list on alert: {}", json);
            return new ArrayList<>();
        }
    }

    private Key alertKey(String alertId) {
        return new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
    }

    private Key guardKey(String source) {
        return new Key(namespace, AerospikeConfig.SET_OPEN_ALERT_GUARDS, source);
    }
}
