package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.List;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.ResultRow;

public record TranscriptSearchResponse(String query, List<Hit> results, CacheStatus cacheStatus) {

    /**
     * {@code snippet} may contain {@code <b>} highlight tags produced by the full-text search.
     */
    public record Hit(
            String sourceTranscriptId,
            String caseType,
            Integer qualityScore,
            String callStartDate,
            String headline,
            String snippet
    ) {

        public static Hit from(ResultRow row) {
            return new Hit(
                    row.getString("source_transcript_id"),
                    row.has("case_type") ? row.getString("case_type") : "Unknown",
                    row.getInteger("quality_score"),
                    row.getString("call_start_date"),
                    row.has("headline") ? row.getString("headline") : "",
                    row.has("snippet") ? row.getString("snippet") : ""
            );
        }
    }
}
