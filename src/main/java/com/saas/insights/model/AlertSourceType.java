package com.saas.insights.model;

public enum AlertSourceType {
    RULE,
    ANOMALY
}
