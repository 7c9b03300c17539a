package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.OffsetDateTime;

import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.transcripts.domain.TestimonialStatus;

public record TestimonialResponse(
        String sourceTranscriptId,
        String caseType,
        String testimonialType,
        Integer qualityScore,
        String keyQuote,
        String status,
        String nextStatus,
        String notes,
        OffsetDateTime statusUpdatedAt,
        String statusUpdatedBy
) {

    public static TestimonialResponse from(ResultRow row) {
        String status = row.has("status") ? row.getString("status") : TestimonialStatus.FLAGGED.value();
        String next = TestimonialStatus.parse(status)
                .flatMap(TestimonialStatus::next)
                .map(TestimonialStatus::value)
                .orElse(null);
        return new TestimonialResponse(
                row.getString("source_transcript_id"),
                row.getString("case_type"),
                row.getString("testimonial_type"),
                row.getInteger("quality_score"),
                row.getString("key_quote"),
                status,
                next,
                row.getString("notes"),
                row.getOffsetDateTime("status_updated_at"),
                row.getString("status_updated_by")
        );
    }
}
