package com.walkerbrain.portal.modules.transcripts.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.application.RowNormalizer;
import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TranscriptSearchResponse;

import org.springframework.stereotype.Service;

/**
 * Keyword search over full transcript text, delegated to the store's full-text search function.
 */
@Service
public class TranscriptSearchService {

    static final int MAX_RESULTS = 50;

    private final CachedQueryExecutor executor;
    private final RelationalStore store;
    private final RowNormalizer rowNormalizer;
    private final QueryRetrier retrier;

    public TranscriptSearchService(
            CachedQueryExecutor executor,
            RelationalStore store,
            RowNormalizer rowNormalizer,
            QueryRetrier retrier
    ) {
        this.executor = executor;
        this.store = store;
        this.rowNormalizer = rowNormalizer;
        this.retrier = retrier;
    }

    public TranscriptSearchResponse search(String query, int minQuality, int limit) {
        String keyword = query == null ? "" : query.strip();
        if (keyword.isEmpty()) {
            return new TranscriptSearchResponse("", List.of(), CacheStatus.BYPASS);
        }
        int quality = Math.min(100, Math.max(0, minQuality));
        int maxResults = Math.min(MAX_RESULTS, Math.max(1, limit));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", keyword);
        params.put("min_quality", quality);
        params.put("max_results", maxResults);

        QueryKey key = QueryKey.builder(TranscriptSources.SEARCH_TRANSCRIPTS, QueryShape.ROWS)
                .variant(keyword + ":" + quality)
                .limit(maxResults)
                .build();
        QueryResult<List<ResultRow>> rows = retrier.withRetry("transcripts:search", () -> executor.execute(key,
                () -> rowNormalizer.normalize(store.callProcedure(TranscriptSources.SEARCH_TRANSCRIPTS, params))));
        return new TranscriptSearchResponse(
                keyword,
                rows.value().stream().map(TranscriptSearchResponse.Hit::from).toList(),
                rows.cacheStatus()
        );
    }
}
