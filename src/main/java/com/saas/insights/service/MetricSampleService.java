package com.saas.insights.service;

import com.saas.insights.model.MetricSample;
import com.saas.insights.repository.MetricSampleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ingestion and read-back of daily metric values.
 */
@Service
public class MetricSampleService {

    private static final Logger log = LoggerFactory.getLogger(MetricSampleService.class);

    // Metric names end up in record keys ("metric|day"), so no separators.
    private static final Pattern METRIC_NAME = Pattern.compile("[a-z0-9_\\-.]{1,64}");

    private static final int MAX_RANGE_DAYS = 366;

    private final MetricSampleRepository sampleRepository;
    private final Clock clock;

    public MetricSampleService(MetricSampleRepository sampleRepository, Clock clock) {
        this.sampleRepository = sampleRepository;
        this.clock = clock;
    }

    /**
     * Store a value for a day. With {@code increment} the value is added to what is stored.
     *
     * @return the stored sample
     */
    public MetricSample record(String metric, LocalDate day, double value, boolean increment) {
        validateName(metric);
        LocalDate effectiveDay = day != null ? day : LocalDate.now(clock);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be a finite number");
        }

        if (increment) {
            sampleRepository.increment(metric, effectiveDay, value);
            MetricSample stored = sampleRepository.findOne(metric, effectiveDay);
            log.debug("Incremented {} on {} by {}", metric, effectiveDay, value);
            return stored != null ? stored : new MetricSample(metric, effectiveDay, value);
        }

        MetricSample sample = new MetricSample(metric, effectiveDay, value);
        sampleRepository.save(sample);
        log.debug("Stored {} = {} for {}", metric, value, effectiveDay);
        return sample;
    }

    /**
     * Samples in {@code [from, to]} (both inclusive). Defaults to the last 7 days.
     */
    public List<MetricSample> list(String metric, LocalDate from, LocalDate to) {
        validateName(metric);
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.minusDays(6);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        if (start.plusDays(MAX_RANGE_DAYS).isBefore(end)) {
            throw new IllegalArgumentException("range must not exceed " + MAX_RANGE_DAYS + " days");
        }
        return sampleRepository.findRange(metric, start, end.plusDays(1));
    }

    private static void validateName(String metric) {
        if (metric == null || !METRIC_NAME.matcher(metric).matches()) {
            throw new IllegalArgumentException("metric name must match " + METRIC_NAME.pattern());
        }
    }
}
