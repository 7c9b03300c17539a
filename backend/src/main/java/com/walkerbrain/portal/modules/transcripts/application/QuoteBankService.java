package com.walkerbrain.portal.modules.transcripts.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.PaginationService;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.PageCursor;
import com.walkerbrain.portal.modules.query.domain.PagedResult;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.CallFilterCriteria;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.QuoteResponse;

import org.springframework.stereotype.Service;

/**
 * Browsable bank of customer quotes, best first.
 */
@Service
public class QuoteBankService {

    private final CachedQueryExecutor executor;
    private final PaginationService paginationService;
    private final FilterCompiler filterCompiler;
    private final QueryRetrier retrier;
    private final Clock clock;

    public QuoteBankService(
            CachedQueryExecutor executor,
            PaginationService paginationService,
            FilterCompiler filterCompiler,
            QueryRetrier retrier,
            Clock clock
    ) {
        this.executor = executor;
        this.paginationService = paginationService;
        this.filterCompiler = filterCompiler;
        this.retrier = retrier;
        this.clock = clock;
    }

    public PagedResult<QuoteResponse> quotes(CallFilterCriteria criteria, int pageIndex, int pageSize) {
        List<FilterSpec> specs = new ArrayList<>(criteria.toFilterSpecs());
        specs.add(FilterSpec.nullCheck("key_quote", true));
        CompiledFilter filter = filterCompiler.compile(specs);

        QueryKey base = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .columns(TranscriptSources.QUOTE_COLUMNS)
                .filter(filter)
                .orderBy(SortOrder.desc("quality_score"), SortOrder.desc("analyzed_at"))
                .build();

        QueryResult<Long> total = retrier.withRetry("quotes:count", () -> paginationService.count(base));
        PageCursor cursor = paginationService.forPageIndex(pageIndex, pageSize, total.value());
        if (total.value() == 0) {
            return new PagedResult<>(List.of(), cursor, total.cacheStatus());
        }

        QueryKey pageKey = base.withPage(pageSize, (int) cursor.offset());
        QueryResult<List<ResultRow>> rows = retrier.withRetry("quotes:page", () -> executor.execute(pageKey));
        List<QuoteResponse> quotes = rows.value().stream().map(QuoteResponse::from).toList();
        return new PagedResult<>(quotes, cursor, combine(total.cacheStatus(), rows.cacheStatus()));
    }

    /**
     * Highest-scoring quotes analysed within the last {@code days} days. The window start is truncated to
     * the hour so repeated calls share a cache key.
     */
    public QueryResult<List<QuoteResponse>> topQuotes(int days, int limit) {
        OffsetDateTime since = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).minusDays(days)
                .truncatedTo(ChronoUnit.HOURS);
        CompiledFilter filter = filterCompiler.compile(List.of(
                FilterSpec.nullCheck("key_quote", true),
                new FilterSpec.Range("analyzed_at", since, null, false)
        ));
        QueryKey key = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .variant("top-quotes:" + days)
                .columns(TranscriptSources.QUOTE_COLUMNS)
                .filter(filter)
                .orderBy(SortOrder.desc("quality_score"))
                .limit(limit)
                .build();
        return retrier.withRetry("quotes:top", () -> executor.execute(key))
                .map(rows -> rows.stream().map(QuoteResponse::from).toList());
    }

    static CacheStatus combine(CacheStatus first, CacheStatus second) {
        if (first == CacheStatus.HIT && second == CacheStatus.HIT) {
            return CacheStatus.HIT;
        }
        if (first == CacheStatus.BYPASS && second == CacheStatus.BYPASS) {
            return CacheStatus.BYPASS;
        }
        return CacheStatus.MISS;
    }
}
