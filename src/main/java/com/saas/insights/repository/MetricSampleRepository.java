package com.saas.insights.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.saas.insights.config.AerospikeConfig;
import com.saas.insights.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Daily metric values, one record per (metric, day). Key: "{metric}|{yyyy-MM-dd}".
 */
@Repository
public class MetricSampleRepository implements MetricSampleProvider {

    private static final Logger log = LoggerFactory.getLogger(MetricSampleRepository.class);

    private static final String BIN_METRIC = "metric";
    private static final String BIN_DAY = "day";
    private static final String BIN_EPOCH_DAY = "epochDay";
    private static final String BIN_VALUE = "value";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy;
    private final FallbackExecutor fallbackExecutor;

    public MetricSampleRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy,
                                  @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy,
                                  FallbackExecutor fallbackExecutor) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.batchPolicy = batchPolicy;
        this.fallbackExecutor = fallbackExecutor;
    }

    @Override
    public double getValue(String metric, LocalDate dayStart, LocalDate dayEnd) {
        if (!dayEnd.isAfter(dayStart)) {
            return 0.0;
        }
        return fallbackExecutor.execute("metric-value:" + metric,
                () -> sumByKeys(metric, dayStart, dayEnd),
                () -> sumByScan(metric, dayStart, dayEnd),
                0.0);
    }

    @Override
    public boolean isAvailable() {
        return client.isConnected();
    }

    /**
     * Samples of {@code metric} for days in {@code [from, to)}, ascending by day. Days without
     * a record are omitted.
     */
    public List<MetricSample> findRange(String metric, LocalDate from, LocalDate to) {
        if (!to.isAfter(from)) {
            return List.of();
        }
        return fallbackExecutor.execute("metric-range:" + metric,
                () -> rangeByKeys(metric, from, to),
                () -> rangeByScan(metric, from, to),
                List.of());
    }

    public MetricSample findOne(String metric, LocalDate day) {
        Record record = client.get(readPolicy, key(metric, day));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Overwrite the value for a (metric, day).
     */
    public void save(MetricSample sample) {
        Key key = key(sample.getMetric(), sample.getDay());
        client.put(writePolicy, key,
                new Bin(BIN_METRIC, sample.getMetric()),
                new Bin(BIN_DAY, sample.getDay().toString()),
                new Bin(BIN_EPOCH_DAY, sample.getDay().toEpochDay()),
                new Bin(BIN_VALUE, sample.getValue()));
    }

    /**
     * Atomically add {@code delta} to the value for a (metric, day), creating the record if needed.
     */
    public void increment(String metric, LocalDate day, double delta) {
        Key key = key(metric, day);
        client.operate(writePolicy, key,
                Operation.put(new Bin(BIN_METRIC, metric)),
                Operation.put(new Bin(BIN_DAY, day.toString())),
                Operation.put(new Bin(BIN_EPOCH_DAY, day.toEpochDay())),
                Operation.add(new Bin(BIN_VALUE, delta)));
    }

    private double sumByKeys(String metric, LocalDate dayStart, LocalDate dayEnd) {
        Record[] records = client.get(batchPolicy, keys(metric, dayStart, dayEnd));
        double total = 0.0;
        for (Record record : records) {
            if (record != null) {
                total += readValue(record);
            }
        }
        return total;
    }

    private double sumByScan(String metric, LocalDate dayStart, LocalDate dayEnd) {
        DoubleAdder total = new DoubleAdder();
        long from = dayStart.toEpochDay();
        long to = dayEnd.toEpochDay();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_METRIC_DAILY_VALUES,
                (key, record) -> {
                    if (matches(record, metric, from, to)) {
                        total.add(readValue(record));
                    }
                });
        return total.sum();
    }

    private List<MetricSample> rangeByKeys(String metric, LocalDate from, LocalDate to) {
        Record[] records = client.get(batchPolicy, keys(metric, from, to));
        List<MetricSample> samples = new ArrayList<>();
        for (Record record : records) {
            if (record != null) {
                samples.add(mapRecord(record));
            }
        }
        return samples;
    }

    private List<MetricSample> rangeByScan(String metric, LocalDate from, LocalDate to) {
        List<MetricSample> samples = Collections.synchronizedList(new ArrayList<>());
        long fromDay = from.toEpochDay();
        long toDay = to.toEpochDay();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_METRIC_DAILY_VALUES,
                (key, record) -> {
                    if (matches(record, metric, fromDay, toDay)) {
                        samples.add(mapRecord(record));
                    }
                });
        List<MetricSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(MetricSample::getDay));
        return sorted;
    }

    private boolean matches(Record record, String metric, long fromEpochDay, long toEpochDay) {
        if (!metric.equals(record.getString(BIN_METRIC))) {
            return false;
        }
        long epochDay = record.getLong(BIN_EPOCH_DAY);
        return epochDay >= fromEpochDay && epochDay < toEpochDay;
    }

    private MetricSample mapRecord(Record record) {
        return MetricSample.builder()
                .metric(record.getString(BIN_METRIC))
                .day(LocalDate.ofEpochDay(record.getLong(BIN_EPOCH_DAY)))
                .value(readValue(record))
                .build();
    }

    // Values written through Operation.add on an integer bin come back as long.
    private double readValue(Record record) {
        Object value = record.getValue(BIN_VALUE);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        log.warn("Non-numeric metric value in bin '{}': {}", BIN_VALUE, value);
        return 0.0;
    }

    private Key[] keys(String metric, LocalDate from, LocalDate to) {
        List<Key> keys = new ArrayList<>();
        for (LocalDate day = from; day.isBefore(to); day = day.plusDays(1)) {
            keys.add(key(metric, day));
        }
        return keys.toArray(new Key[0]);
    }

    private Key key(String metric, LocalDate day) {
        return new Key(namespace, AerospikeConfig.SET_METRIC_DAILY_VALUES, metric + "|" + day);
    }

    private static ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        return scanPolicy;
    }
}
