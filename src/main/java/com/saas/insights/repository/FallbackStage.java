package com.saas.insights.repository;

/**
 * Stages of a read against external data, tried in order.
 */
public enum FallbackStage {
    PRIMARY,        // key lookup or indexed query
    BROAD_SCAN,     // scan the whole set and filter in memory
    SAFE_DEFAULT    // zero / empty, so dashboards show "no data" instead of failing
}
