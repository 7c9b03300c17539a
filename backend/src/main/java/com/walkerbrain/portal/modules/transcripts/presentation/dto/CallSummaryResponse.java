package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.walkerbrain.portal.modules.query.domain.ResultRow;

public record CallSummaryResponse(
        String sourceTranscriptId,
        String caseType,
        Integer qualityScore,
        String emotionalTone,
        String outcome,
        OffsetDateTime analyzedAt,
        String language,
        String keyQuote,
        String summary,
        String primaryTopic,
        List<String> suggestedTags,
        boolean contentWorthy,
        boolean testimonialCandidate,
        String testimonialType,
        Double confidenceScore,
        String estimatedCaseValueCategory
) {

    public static CallSummaryResponse from(ResultRow row) {
        return new CallSummaryResponse(
                row.getString("source_transcript_id"),
                row.getString("case_type"),
                row.getInteger("quality_score"),
                row.getString("emotional_tone"),
                row.getString("outcome"),
                row.getOffsetDateTime("analyzed_at"),
                row.getString("original_language"),
                row.getString("key_quote"),
                row.getString("summary"),
                row.getString("primary_topic"),
                row.getStringList("suggested_tags"),
                row.getBoolean("content_generation_flag"),
                row.getBoolean("testimonial_candidate"),
                row.getString("testimonial_type"),
                row.getDouble("confidence_score"),
                row.getString("estimated_case_value_category")
        );
    }
}
