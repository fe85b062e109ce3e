package com.saas.insights.repository;

import com.saas.insights.config.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a data read through the {@link FallbackStage} chain: primary lookup, then a
 * broad scan filtered in memory, then a safe default. Reads never throw.
 */
@Component
public class FallbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(FallbackExecutor.class);

    private final MetricsConfig metricsConfig;

    public FallbackExecutor(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    /**
     * @param operation   name used in logs and metrics
     * @param primary     indexed or key-based read
     * @param broadScan   full scan + in-memory filter, or null when there is no broader read
     * @param safeDefault value returned when every stage failed
     */
    public <T> T execute(String operation, Supplier<T> primary, Supplier<T> broadScan, T safeDefault) {
        try {
            return readThroughStages(operation, primary, broadScan);
        } catch (DataUnavailableException e) {
            metricsConfig.recordDataFallback(operation, FallbackStage.SAFE_DEFAULT.name());
            log.warn("{}: returning safe default", operation);
            return safeDefault;
        }
    }

    /**
     * Same chain without a safe default, for reads where an empty answer would be mistaken for
     * a real one (e.g. "no such subject").
     *
     * @throws DataUnavailableException when every stage failed
     */
    public <T> T executeRequired(String operation, Supplier<T> primary, Supplier<T> broadScan) {
        return readThroughStages(operation, primary, broadScan);
    }

    private <T> T readThroughStages(String operation, Supplier<T> primary, Supplier<T> broadScan) {
        Exception lastFailure;
        try {
            return primary.get();
        } catch (Exception e) {
            lastFailure = e;
            log.warn("{}: primary read failed: {}", operation, e.getMessage());
        }

        if (broadScan != null) {
            metricsConfig.recordDataFallback(operation, FallbackStage.BROAD_SCAN.name());
            try {
                T result = broadScan.get();
                log.info("{}: served from broad scan", operation);
                return result;
            } catch (Exception e) {
                lastFailure = e;
                log.error("{}: broad scan failed: {}", operation, e.getMessage(), e);
            }
        }
        throw new DataUnavailableException(operation, lastFailure);
    }
}
