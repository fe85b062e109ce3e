package com.saas.insights.model;

/**
 * Fixed-width band around a point forecast. Not a statistically derived interval.
 */
public record ConfidenceInterval(double lower, double upper) {

    public static ConfidenceInterval around(double value, double fraction) {
        double a = value * (1.0 - fraction);
        double b = value * (1.0 + fraction);
        return new ConfidenceInterval(Math.min(a, b), Math.max(a, b));
    }
}
