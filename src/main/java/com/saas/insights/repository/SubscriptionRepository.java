package com.saas.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.query.Filter;
import com.aerospike.client.query.RecordSet;
import com.aerospike.client.query.Statement;
import com.saas.insights.config.AerospikeConfig;
import com.saas.insights.model.Subscription;
import com.saas.insights.model.SubscriptionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Subscriptions are queried through a secondary index on the "status" bin. When the index is
 * missing or the query fails, the whole set is scanned and filtered.
 */
@Repository
public class SubscriptionRepository implements SubscriptionSource {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final FallbackExecutor fallbackExecutor;

    public SubscriptionRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  FallbackExecutor fallbackExecutor) {
        this.client = client;
        this.namespace = namespace;
        this.fallbackExecutor = fallbackExecutor;
    }

    @Override
    public List<Subscription> findActive() {
        return fallbackExecutor.execute("subscriptions-active",
                () -> queryByStatus(SubscriptionStatus.ACTIVE),
                () -> scanByStatus(SubscriptionStatus.ACTIVE),
                List.of());
    }

    @Override
    public long countCanceledSince(long sinceEpochMillis) {
        return fallbackExecutor.execute("subscriptions-canceled",
                () -> countSince(queryByStatus(SubscriptionStatus.CANCELED), sinceEpochMillis),
                () -> countSince(scanByStatus(SubscriptionStatus.CANCELED), sinceEpochMillis),
                0L);
    }

    private static long countSince(List<Subscription> canceled, long sinceEpochMillis) {
        return canceled.stream()
                .filter(s -> s.getCanceledAt() >= sinceEpochMillis)
                .count();
    }

    private List<Subscription> queryByStatus(SubscriptionStatus status) {
        Statement statement = new Statement();
        statement.setNamespace(namespace);
        statement.setSetName(AerospikeConfig.SET_SUBSCRIPTIONS);
        statement.setFilter(Filter.equal("status", status.name()));

        List<Subscription> result = new ArrayList<>();
        try (RecordSet recordSet = client.query(new QueryPolicy(), statement)) {
            while (recordSet.next()) {
                result.add(mapRecord(recordSet.getRecord()));
            }
        }
        return result;
    }

    private List<Subscription> scanByStatus(SubscriptionStatus status) {
        List<Subscription> result = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUBSCRIPTIONS,
                (key, record) -> {
                    if (status.name().equals(record.getString("status"))) {
                        try {
                            result.add(mapRecord(record));
                        } catch (Exception e) {
                            log.warn("Failed to deserialize subscription record: {}", e.getMessage());
                        }
                    }
                });
        return new ArrayList<>(result);
    }

    private Subscription mapRecord(Record record) {
        return Subscription.builder()
                .subscriptionId(record.getString("subscriptionId"))
                .subjectId(record.getString("subjectId"))
                .plan(record.getString("plan"))
                .status(SubscriptionStatus.valueOf(record.getString("status")))
                .createdAt(record.getLong("createdAt"))
                .canceledAt(record.getLong("canceledAt"))
                .build();
    }
}
