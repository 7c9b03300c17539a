package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;

public record HighlightsResponse(
        int days,
        PeriodMetrics current,
        PeriodMetrics prior,
        List<QuoteResponse> topQuotes,
        List<DailyVolume> dailyVolume,
        CacheStatus cacheStatus
) {

    public record PeriodMetrics(long quotes, long testimonials, long contentWorthy, int medianQuality) {
    }

    public record DailyVolume(LocalDate date, long count, double averageQuality) {
    }
}
