package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Threshold comparison applied by an alert rule. {@link #EQ} is an exact
 * comparison with no tolerance.
 */
public enum ComparisonOperator {
    GT("gt") {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    GTE("gte") {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT("lt") {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    },
    EQ("eq") {
        @Override
        public boolean test(double value, double threshold) {
            return value == threshold;
        }
    };

    private final String key;

    ComparisonOperator(String key) {
        this.key = key;
    }

    public abstract boolean test(double value, double threshold);

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static ComparisonOperator fromKey(String value) {
        for (ComparisonOperator op : values()) {
            if (op.key.equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }
}
