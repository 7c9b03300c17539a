package com.walkerbrain.portal.modules.transcripts.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Angle bank filters. Statuses default to the reviewable ones; intents live inside the generated JSON
 * content and are matched after the rows are fetched.
 */
public record AngleFilterCriteria(
        List<String> statuses,
        List<String> contentTypes,
        List<String> intents,
        Integer minQuality,
        Integer maxQuality,
        LocalDate startDate,
        LocalDate endDate
) {

    public static final List<String> DEFAULT_STATUSES = List.of("pending_review", "approved");

    public List<String> effectiveStatuses() {
        return statuses == null || statuses.isEmpty() ? DEFAULT_STATUSES : statuses;
    }
}
