package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;

public record PipelineStatsResponse(
        long totalAnalyzed,
        LocalDate since,
        boolean systemActive,
        OffsetDateTime lastUpdated,
        CacheStatus cacheStatus
) {
}
