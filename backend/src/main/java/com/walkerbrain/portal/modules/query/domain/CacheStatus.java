package com.walkerbrain.portal.modules.query.domain;

/**
 * Freshness indicator handed back to the dashboard with each result.
 */
public enum CacheStatus {
    HIT,
    MISS,
    /** answered without cache or store, e.g. an empty membership selection */
    BYPASS
}
