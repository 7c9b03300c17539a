package com.walkerbrain.portal.modules.transcripts.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.walkerbrain.portal.modules.query.domain.FilterSpec;

/**
 * Filter state of the quote bank and call search screens. A {@code null} list leaves its column
 * unfiltered; a supplied but empty list selects nothing. Dates are whole UTC days, both inclusive.
 */
public record CallFilterCriteria(
        String text,
        List<String> caseTypes,
        List<String> tones,
        List<String> languages,
        Integer minQuality,
        Integer maxQuality,
        LocalDate startDate,
        LocalDate endDate,
        boolean hasQuote,
        boolean contentWorthy,
        boolean testimonialOnly
) {

    public static CallFilterCriteria none() {
        return new CallFilterCriteria(null, null, null, null, null, null, null, null, false, false, false);
    }

    public List<FilterSpec> toFilterSpecs() {
        List<FilterSpec> specs = new ArrayList<>();
        specs.add(FilterSpec.range("quality_score",
                minQuality == null ? 0 : minQuality,
                maxQuality == null ? 100 : maxQuality));
        if (text != null && !text.isBlank()) {
            specs.add(FilterSpec.textSearch(TranscriptSources.TEXT_SEARCH_COLUMNS, text));
        }
        addMembership(specs, "case_type", caseTypes);
        addMembership(specs, "emotional_tone", tones);
        addMembership(specs, "original_language", languages);
        if (startDate != null || endDate != null) {
            specs.add(analyzedBetween(startDate, endDate));
        }
        if (hasQuote) {
            specs.add(FilterSpec.nullCheck("key_quote", true));
        }
        if (contentWorthy) {
            specs.add(FilterSpec.equality("content_generation_flag", true));
        }
        if (testimonialOnly) {
            specs.add(FilterSpec.equality("testimonial_candidate", true));
        }
        return specs;
    }

    static FilterSpec analyzedBetween(LocalDate start, LocalDate end) {
        return FilterSpec.calendarDays("analyzed_at", start, end);
    }

    private static void addMembership(List<FilterSpec> specs, String field, List<String> values) {
        if (values == null) {
            return;
        }
        List<String> cleaned = values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .toList();
        specs.add(FilterSpec.membership(field, cleaned));
    }
}
