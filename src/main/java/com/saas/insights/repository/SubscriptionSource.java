package com.saas.insights.repository;

import com.saas.insights.model.Subscription;

import java.util.List;

public interface SubscriptionSource {

    List<Subscription> findActive();

    long countCanceledSince(long sinceEpochMillis);
}
