package com.saas.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {
    private String subscriptionId;
    private String subjectId;
    private String plan;
    private SubscriptionStatus status;
    private long createdAt;
    private long canceledAt;            // 0 unless canceled
}
