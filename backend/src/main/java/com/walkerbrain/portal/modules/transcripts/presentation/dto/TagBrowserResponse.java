package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.List;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;

/**
 * Tags from the curated taxonomy, or mined from recent analyses when the taxonomy is empty
 * ({@code source} is {@code "taxonomy"} or {@code "analysis"}). Mined tags never carry categories.
 */
public record TagBrowserResponse(
        String source,
        List<TagCategory> categories,
        List<TagCount> tags,
        CacheStatus cacheStatus
) {

    public record TagCategory(String name, List<TagCount> tags) {
    }

    public record TagCount(String tag, long count) {
    }
}
