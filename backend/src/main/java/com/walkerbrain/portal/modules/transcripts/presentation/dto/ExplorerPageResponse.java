package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.PageCursor;

/**
 * One explorer page. {@code zeroQualityRows} counts matching rows scored 0, which usually mark a failed
 * analysis.
 */
public record ExplorerPageResponse(
        List<String> groups,
        List<String> columns,
        List<Map<String, Object>> rows,
        PageCursor page,
        long zeroQualityRows,
        CacheStatus cacheStatus
) {
}
