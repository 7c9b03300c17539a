package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.walkerbrain.portal.modules.query.domain.ResultRow;

public record TaggedCallResponse(
        String sourceTranscriptId,
        String caseType,
        Integer qualityScore,
        String emotionalTone,
        OffsetDateTime analyzedAt,
        String keyQuote,
        String summary,
        List<String> suggestedTags
) {

    public static TaggedCallResponse from(ResultRow row) {
        return new TaggedCallResponse(
                row.getString("source_transcript_id"),
                row.getString("case_type"),
                row.getInteger("quality_score"),
                row.getString("emotional_tone"),
                row.getOffsetDateTime("analyzed_at"),
                row.getString("key_quote"),
                row.getString("summary"),
                row.getStringList("suggested_tags")
        );
    }
}
