package com.saas.insights.model;

public enum AlertSeverity {
    WARNING,
    CRITICAL
}
