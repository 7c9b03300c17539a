package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.domain.ResultRow;

public record AngleResponse(
        Long id,
        String contentType,
        String injuryType,
        Integer qualityScore,
        String status,
        OffsetDateTime createdAt,
        String generationModel,
        String creativeAngle,
        String callSummary,
        String contentIntent,
        List<String> keyQuotes,
        Map<String, Object> emotionalArc,
        String whyThisAngle,
        String funnelStageHint
) {

    public static AngleResponse from(ResultRow row) {
        Map<String, Object> content = row.getMap("content_text");
        return new AngleResponse(
                row.getLong("id"),
                row.getString("content_type"),
                row.getString("injury_type"),
                row.getInteger("quality_score"),
                row.getString("status"),
                row.getOffsetDateTime("created_at"),
                row.getString("generation_model"),
                text(content, "creative_angle"),
                text(content, "call_summary"),
                text(content, "content_intent"),
                content.get("key_quotes") instanceof List<?> quotes
                        ? quotes.stream().map(String::valueOf).toList()
                        : List.of(),
                content.get("emotional_arc") instanceof Map<?, ?> arc ? stringKeys(arc) : Map.of(),
                text(content, "why_this_angle"),
                text(content, "funnel_stage_hint")
        );
    }

    private static String text(Map<String, Object> content, String key) {
        Object value = content.get(key);
        return value == null ? "" : value.toString();
    }

    private static Map<String, Object> stringKeys(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
