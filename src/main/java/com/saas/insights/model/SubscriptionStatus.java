package com.saas.insights.model;

public enum SubscriptionStatus {
    ACTIVE,
    PAST_DUE,
    CANCELED
}
