package com.saas.insights.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score >= 80) return CRITICAL;
        if (score > 70) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }
}
