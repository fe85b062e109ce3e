package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Trend {
    INCREASING,
    STABLE,
    DECREASING;

    @JsonValue
    public String getKey() {
        return name().toLowerCase();
    }

    public static Trend fromGrowth(double growth, double band) {
        if (growth > band) return INCREASING;
        if (growth < -band) return DECREASING;
        return STABLE;
    }
}
