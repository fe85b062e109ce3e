package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastPeriod {
    DAYS_30("30d", 30),
    DAYS_60("60d", 60),
    DAYS_90("90d", 90);

    private final String key;
    private final int days;

    ForecastPeriod(String key, int days) {
        this.key = key;
        this.days = days;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public int getDays() {
        return days;
    }

    @JsonCreator
    public static ForecastPeriod fromKey(String value) {
        for (ForecastPeriod period : values()) {
            if (period.key.equalsIgnoreCase(value)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown forecast period: " + value + " (expected 30d, 60d or 90d)");
    }
}
