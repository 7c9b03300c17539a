package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;

public record SystemStatusResponse(
        boolean active,
        long processedLast7Days,
        double averagePerDay,
        double averageQuality,
        CacheStatus cacheStatus
) {
}
