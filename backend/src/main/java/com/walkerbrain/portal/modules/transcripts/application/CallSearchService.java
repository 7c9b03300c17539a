package com.walkerbrain.portal.modules.transcripts.application;

import java.util.ArrayList;
import java.util.List;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.PaginationService;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
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
import com.walkerbrain.portal.modules.transcripts.presentation.dto.CallDetailResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.CallSummaryResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TranscriptResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class CallSearchService {

    static final String CALL_NOT_FOUND = "CALL_NOT_FOUND";

    private final CachedQueryExecutor executor;
    private final PaginationService paginationService;
    private final FilterCompiler filterCompiler;
    private final QueryRetrier retrier;

    public CallSearchService(
            CachedQueryExecutor executor,
            PaginationService paginationService,
            FilterCompiler filterCompiler,
            QueryRetrier retrier
    ) {
        this.executor = executor;
        this.paginationService = paginationService;
        this.filterCompiler = filterCompiler;
        this.retrier = retrier;
    }

    public PagedResult<CallSummaryResponse> search(CallFilterCriteria criteria, int pageIndex, int pageSize) {
        CompiledFilter filter = filterCompiler.compile(criteria.toFilterSpecs());
        QueryKey base = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .columns(TranscriptSources.SEARCH_COLUMNS)
                .filter(filter)
                .orderBy(SortOrder.desc("analyzed_at"))
                .build();

        QueryResult<Long> total = retrier.withRetry("calls:count", () -> paginationService.count(base));
        PageCursor cursor = paginationService.forPageIndex(pageIndex, pageSize, total.value());
        if (total.value() == 0) {
            return new PagedResult<>(List.of(), cursor, total.cacheStatus());
        }
        QueryKey pageKey = base.withPage(pageSize, (int) cursor.offset());
        QueryResult<List<ResultRow>> rows = retrier.withRetry("calls:page", () -> executor.execute(pageKey));
        return new PagedResult<>(
                rows.value().stream().map(CallSummaryResponse::from).toList(),
                cursor,
                QuoteBankService.combine(total.cacheStatus(), rows.cacheStatus())
        );
    }

    public CallDetailResponse detail(String sourceTranscriptId) {
        List<String> columns = new ArrayList<>(TranscriptSources.SEARCH_COLUMNS);
        columns.addAll(TranscriptSources.DETAIL_COLUMNS);
        QueryResult<List<ResultRow>> rows = byId(sourceTranscriptId, columns, "calls:detail");
        return CallDetailResponse.from(first(rows, sourceTranscriptId), TranscriptSources.DETAIL_COLUMNS,
                rows.cacheStatus());
    }

    public TranscriptResponse transcript(String sourceTranscriptId) {
        QueryResult<List<ResultRow>> rows = byId(sourceTranscriptId,
                List.of("source_transcript_id", "transcript_original"), "calls:transcript");
        ResultRow row = first(rows, sourceTranscriptId);
        String text = row.getString("transcript_original");
        return new TranscriptResponse(sourceTranscriptId, text == null ? "" : text);
    }

    private QueryResult<List<ResultRow>> byId(String sourceTranscriptId, List<String> columns, String operation) {
        CompiledFilter filter = filterCompiler.compile(
                List.of(FilterSpec.equality("source_transcript_id", sourceTranscriptId)));
        QueryKey key = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .columns(columns)
                .filter(filter)
                .limit(1)
                .build();
        return retrier.withRetry(operation, () -> executor.execute(key));
    }

    private static ResultRow first(QueryResult<List<ResultRow>> rows, String sourceTranscriptId) {
        if (rows.value().isEmpty()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, CALL_NOT_FOUND,
                    "No analysed call with id " + sourceTranscriptId + ".");
        }
        return rows.value().get(0);
    }
}
