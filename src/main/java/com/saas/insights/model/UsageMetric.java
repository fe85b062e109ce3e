package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Usage series that can be forecast, each backed by a daily sample metric.
 */
public enum UsageMetric {
    TOKENS("tokens", "tokens_used"),
    CONTENT_UNITS("content-units", "content_created"),
    NEW_ACCOUNTS("new-accounts", "accounts_created");

    private final String key;
    private final String sampleMetric;

    UsageMetric(String key, String sampleMetric) {
        this.key = key;
        this.sampleMetric = sampleMetric;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getSampleMetric() {
        return sampleMetric;
    }

    @JsonCreator
    public static UsageMetric fromKey(String value) {
        for (UsageMetric metric : values()) {
            if (metric.key.equalsIgnoreCase(value)) {
                return metric;
            }
        }
        throw new IllegalArgumentException(
                "Unknown usage metric: " + value + " (expected tokens, content-units or new-accounts)");
    }
}
