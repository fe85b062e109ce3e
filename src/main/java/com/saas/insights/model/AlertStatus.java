package com.saas.insights.model;

public enum AlertStatus {
    TRIGGERED,
    ACKNOWLEDGED,
    RESOLVED
}
