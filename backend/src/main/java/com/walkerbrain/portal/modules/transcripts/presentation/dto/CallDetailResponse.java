package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.ResultRow;

/**
 * Search-level fields plus the long tail of analysis columns keyed by column name.
 */
public record CallDetailResponse(CallSummaryResponse call, Map<String, Object> analysis, CacheStatus cacheStatus) {

    public static CallDetailResponse from(ResultRow row, List<String> detailColumns, CacheStatus cacheStatus) {
        Map<String, Object> analysis = new LinkedHashMap<>();
        for (String column : detailColumns) {
            analysis.put(column, row.get(column));
        }
        return new CallDetailResponse(CallSummaryResponse.from(row), analysis, cacheStatus);
    }
}
