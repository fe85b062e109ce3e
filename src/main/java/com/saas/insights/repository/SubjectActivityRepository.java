package com.saas.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saas.insights.config.AerospikeConfig;
import com.saas.insights.model.SubjectActivity;
import com.saas.insights.model.SubjectActivity.SentimentSample;
import com.saas.insights.model.SubjectActivity.SupportErrorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of per-subject engagement records. The records are written by the product's
 * event pipeline; the maps and lists are stored as JSON string bins.
 */
@Repository
public class SubjectActivityRepository implements SubjectActivitySource {

    private static final Logger log = LoggerFactory.getLogger(SubjectActivityRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final FallbackExecutor fallbackExecutor;
    private final ObjectMapper objectMapper;

    public SubjectActivityRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultReadPolicy") Policy readPolicy,
                                     FallbackExecutor fallbackExecutor) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.fallbackExecutor = fallbackExecutor;
        this.objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    @Override
    public Optional<SubjectActivity> findBySubjectId(String subjectId) {
        return fallbackExecutor.executeRequired("subject-activity",
                () -> {
                    Key key = new Key(namespace, AerospikeConfig.SET_SUBJECT_ACTIVITY, subjectId);
                    Record record = client.get(readPolicy, key);
                    return record == null ? Optional.<SubjectActivity>empty() : Optional.of(mapRecord(subjectId, record));
                },
                () -> scanActivity(subjectId));
    }

    @Override
    public List<String> listSubjectIds(int limit) {
        if (limit <= 0) return List.of();
        return fallbackExecutor.execute("subject-ids",
                () -> {
                    List<String> ids = Collections.synchronizedList(new ArrayList<>());
                    ScanPolicy scanPolicy = new ScanPolicy();
                    scanPolicy.concurrentNodes = true;
                    scanPolicy.includeBinData = true;
                    scanPolicy.maxRecords = limit;
                    client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUBJECT_ACTIVITY,
                            (key, record) -> {
                                String id = record.getString("subjectId");
                                if (id != null) ids.add(id);
                            }, "subjectId");
                    List<String> result = new ArrayList<>(ids);
                    return result.size() > limit ? result.subList(0, limit) : result;
                },
                null,
                List.of());
    }

    private Optional<SubjectActivity> scanActivity(String subjectId) {
        List<SubjectActivity> found = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUBJECT_ACTIVITY,
                (key, record) -> {
                    if (subjectId.equals(record.getString("subjectId"))) {
                        found.add(mapRecord(subjectId, record));
                    }
                });
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private SubjectActivity mapRecord(String subjectId, Record record) {
        String plan = record.getString("plan");
        return SubjectActivity.builder()
                .subjectId(subjectId)
                .plan(plan != null ? plan : "free")
                .weeklyActivity(readJson(record, "weeklyActivity", new TypeReference<Map<String, Long>>() {}, new HashMap<>()))
                .dailyEventCounts(readJson(record, "dailyEvents", new TypeReference<Map<String, Long>>() {}, new HashMap<>()))
                .sentimentSamples(readJson(record, "sentiment", new TypeReference<List<SentimentSample>>() {}, new ArrayList<>()))
                .supportErrors(readJson(record, "supportErrors", new TypeReference<List<SupportErrorEvent>>() {}, new ArrayList<>()))
                .build();
    }

    private <T> T readJson(Record record, String bin, TypeReference<T> type, T empty) {
        String json = record.getString(bin);
        if (json == null || json.isEmpty()) return empty;
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.warn("Unreadable '{}' bin on subject activity record: {}", bin, e.getMessage());
            return empty;
        }
    }
}
