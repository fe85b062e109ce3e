package com.saas.insights.model;

import lombok.Builder;
import lombok.Data;

/**
 * Partial update of an alert's lifecycle fields. Null fields are left untouched.
 */
@Data
@Builder
public class AlertPatch {
    private Long acknowledgedAt;
    private String acknowledgedBy;
    private Long resolvedAt;
    private String resolvedBy;

    public static AlertPatch acknowledge(long at, String by) {
        return AlertPatch.builder().acknowledgedAt(at).acknowledgedBy(by).build();
    }

    public static AlertPatch resolve(long at, String by) {
        return AlertPatch.builder().resolvedAt(at).resolvedBy(by).build();
    }

    public boolean isResolving() {
        return resolvedAt != null;
    }
}
