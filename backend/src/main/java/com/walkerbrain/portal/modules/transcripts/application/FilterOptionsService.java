package com.walkerbrain.portal.modules.transcripts.application;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RowNormalizer;
import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.FilterOptionsResponse;

import org.springframework.stereotype.Service;

/**
 * Distinct values that populate the dashboard's multiselect filters.
 */
@Service
public class FilterOptionsService {

    private final CachedQueryExecutor executor;
    private final QueryRetrier retrier;

    public FilterOptionsService(CachedQueryExecutor executor, QueryRetrier retrier) {
        this.executor = executor;
        this.retrier = retrier;
    }

    public FilterOptionsResponse options() {
        QueryResult<List<String>> caseTypes = distinct("case_type", UnaryOperator.identity());
        QueryResult<List<String>> tones = distinct("emotional_tone", UnaryOperator.identity());
        QueryResult<List<String>> outcomes = distinct("outcome", UnaryOperator.identity());
        QueryResult<List<String>> languages = distinct("original_language", RowNormalizer::cleanLanguage);
        boolean allHits = caseTypes.isHit() && tones.isHit() && outcomes.isHit() && languages.isHit();
        return new FilterOptionsResponse(
                caseTypes.value(),
                tones.value(),
                outcomes.value(),
                languages.value(),
                allHits ? CacheStatus.HIT : CacheStatus.MISS
        );
    }

    private QueryResult<List<String>> distinct(String column, UnaryOperator<String> cleaner) {
        QueryKey key = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.DICTIONARY)
                .columns(column)
                .orderBy(SortOrder.asc(column))
                .build();
        QueryResult<List<ResultRow>> rows = retrier.withRetry("filter-options:" + column, () -> executor.execute(key));
        return rows.map(values -> {
            Set<String> unique = new LinkedHashSet<>();
            values.stream()
                    .map(row -> row.getString(column))
                    .filter(Objects::nonNull)
                    .map(cleaner)
                    .filter(value -> value != null && !value.isBlank())
                    .forEach(unique::add);
            return unique.stream().sorted().toList();
        });
    }
}
