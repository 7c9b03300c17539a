package com.walkerbrain.portal.modules.transcripts.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.application.RowNormalizer;
import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.HighlightsResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.HighlightsResponse.DailyVolume;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.HighlightsResponse.PeriodMetrics;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.PipelineStatsResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.QuoteResponse;

import org.springframework.stereotype.Service;

/**
 * "This week" dashboard: period metrics against the prior period of equal length, best quotes and the
 * daily call volume.
 */
@Service
public class HighlightsService {

    static final List<String> METRIC_COLUMNS = List.of(
            "key_quote", "testimonial_candidate", "content_generation_flag", "quality_score", "analyzed_at");

    private final CachedQueryExecutor executor;
    private final RelationalStore store;
    private final RowNormalizer rowNormalizer;
    private final FilterCompiler filterCompiler;
    private final QuoteBankService quoteBankService;
    private final QueryRetrier retrier;
    private final Clock clock;

    public HighlightsService(
            CachedQueryExecutor executor,
            RelationalStore store,
            RowNormalizer rowNormalizer,
            FilterCompiler filterCompiler,
            QuoteBankService quoteBankService,
            QueryRetrier retrier,
            Clock clock
    ) {
        this.executor = executor;
        this.store = store;
        this.rowNormalizer = rowNormalizer;
        this.filterCompiler = filterCompiler;
        this.quoteBankService = quoteBankService;
        this.retrier = retrier;
        this.clock = clock;
    }

    public HighlightsResponse highlights(int days) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.HOURS);
        OffsetDateTime currentStart = now.minusDays(days);
        OffsetDateTime priorStart = currentStart.minusDays(days);

        QueryResult<List<ResultRow>> current = window("current", days, currentStart, null);
        QueryResult<List<ResultRow>> prior = window("prior", days, priorStart, currentStart);
        QueryResult<List<QuoteResponse>> top = quoteBankService.topQuotes(days, 5);

        boolean allHits = current.isHit() && prior.isHit() && top.isHit();
        return new HighlightsResponse(
                days,
                metrics(current.value()),
                metrics(prior.value()),
                top.value(),
                dailyVolume(current.value()),
                allHits ? CacheStatus.HIT : CacheStatus.MISS
        );
    }

    public PipelineStatsResponse stats() {
        QueryKey countKey = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.COUNT).build();
        QueryResult<Long> total = retrier.withRetry("stats:total", () -> executor.count(countKey));

        QueryKey earliestKey = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .variant("earliest")
                .columns("analyzed_at")
                .orderBy(SortOrder.asc("analyzed_at"))
                .limit(1)
                .build();
        QueryResult<List<ResultRow>> earliest = retrier.withRetry("stats:earliest", () -> executor.execute(earliestKey));

        QueryKey latestKey = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .variant("latest")
                .columns("analyzed_at")
                .orderBy(SortOrder.desc("analyzed_at"))
                .limit(1)
                .build();
        QueryResult<List<ResultRow>> latest = retrier.withRetry("stats:latest", () -> executor.execute(latestKey));

        QueryKey statusKey = QueryKey.builder(TranscriptSources.SYSTEM_STATUS, QueryShape.ROWS)
                .columns("system_active")
                .limit(1)
                .build();
        QueryResult<List<ResultRow>> status = retrier.withRetry("stats:status", () -> executor.execute(statusKey));

        LocalDate since = earliest.value().isEmpty() ? null : earliest.value().get(0).getLocalDate("analyzed_at");
        OffsetDateTime lastUpdated = latest.value().isEmpty()
                ? null
                : latest.value().get(0).getOffsetDateTime("analyzed_at");
        boolean active = !status.value().isEmpty() && status.value().get(0).getBoolean("system_active");
        boolean allHits = total.isHit() && earliest.isHit() && latest.isHit() && status.isHit();
        return new PipelineStatsResponse(
                total.value(),
                since,
                active,
                lastUpdated,
                allHits ? CacheStatus.HIT : CacheStatus.MISS
        );
    }

    private QueryResult<List<ResultRow>> window(String label, int days, OffsetDateTime start, OffsetDateTime end) {
        CompiledFilter filter = filterCompiler.compile(
                List.of(new FilterSpec.Range("analyzed_at", start, end, true)));
        QueryKey key = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.AGGREGATE)
                .variant("period-metrics:" + label + ":" + days)
                .columns(METRIC_COLUMNS)
                .filter(filter)
                .build();
        RelationalStore.SelectStatement statement = new RelationalStore.SelectStatement(
                key.source(), key.columns(), filter.predicates(), List.of(), null, null, false);
        return retrier.withRetry("highlights:" + label,
                () -> executor.execute(key, () -> rowNormalizer.normalize(store.select(statement))));
    }

    static PeriodMetrics metrics(List<ResultRow> rows) {
        long quotes = 0;
        long testimonials = 0;
        long contentWorthy = 0;
        List<Integer> scores = new ArrayList<>();
        for (ResultRow row : rows) {
            String quote = row.getString("key_quote");
            if (quote != null && !quote.isBlank()) {
                quotes++;
            }
            if (row.getBoolean("testimonial_candidate")) {
                testimonials++;
            }
            if (row.getBoolean("content_generation_flag")) {
                contentWorthy++;
            }
            Integer score = row.getInteger("quality_score");
            if (score != null) {
                scores.add(score);
            }
        }
        return new PeriodMetrics(quotes, testimonials, contentWorthy, median(scores));
    }

    /**
     * Upper median: for an even count the higher of the two middle values.
     */
    static int median(List<Integer> scores) {
        if (scores.isEmpty()) {
            return 0;
        }
        List<Integer> sorted = scores.stream().sorted().toList();
        return sorted.get(sorted.size() / 2);
    }

    static List<DailyVolume> dailyVolume(List<ResultRow> rows) {
        Map<LocalDate, long[]> byDay = new TreeMap<>();
        for (ResultRow row : rows) {
            LocalDate day = row.getLocalDate("analyzed_at");
            if (day == null) {
                continue;
            }
            // calls, score sum, scored calls
            long[] totals = byDay.computeIfAbsent(day, ignored -> new long[3]);
            totals[0]++;
            Integer score = row.getInteger("quality_score");
            if (score != null) {
                totals[1] += score;
                totals[2]++;
            }
        }
        List<DailyVolume> volume = new ArrayList<>();
        byDay.forEach((day, totals) -> volume.add(
                new DailyVolume(day, totals[0], totals[2] == 0 ? 0 : (double) totals[1] / totals[2])));
        return volume;
    }
}
