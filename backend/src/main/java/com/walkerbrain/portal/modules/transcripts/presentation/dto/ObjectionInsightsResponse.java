package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.List;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;

/**
 * Objection categories with week-over-week movement. {@code source} is {@code "weekly"} when read from
 * the weekly frequency view and {@code "recent"} when mined from the last seven days of analyses; mined
 * counts have no prior week and never report a baseline.
 */
public record ObjectionInsightsResponse(
        String source,
        boolean hasBaseline,
        long totalThisWeek,
        long totalLastWeek,
        List<ObjectionTrend> categories,
        CacheStatus cacheStatus
) {

    public record ObjectionTrend(String category, String label, long thisWeek, long lastWeek, long delta) {
    }
}
