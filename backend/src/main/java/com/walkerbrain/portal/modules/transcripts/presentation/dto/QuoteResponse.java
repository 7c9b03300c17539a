package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.walkerbrain.portal.modules.query.domain.ResultRow;

public record QuoteResponse(
        String sourceTranscriptId,
        String keyQuote,
        String caseType,
        String emotionalTone,
        Integer qualityScore,
        String language,
        List<String> suggestedTags,
        OffsetDateTime analyzedAt,
        boolean testimonialCandidate,
        String testimonialType,
        String verbatimCustomerLanguage
) {

    public static QuoteResponse from(ResultRow row) {
        return new QuoteResponse(
                row.getString("source_transcript_id"),
                row.getString("key_quote"),
                row.getString("case_type"),
                row.getString("emotional_tone"),
                row.getInteger("quality_score"),
                row.getString("original_language"),
                row.getStringList("suggested_tags"),
                row.getOffsetDateTime("analyzed_at"),
                row.getBoolean("testimonial_candidate"),
                row.getString("testimonial_type"),
                row.getString("verbatim_customer_language")
        );
    }
}
