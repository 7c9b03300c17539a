package com.walkerbrain.portal.modules.transcripts.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.PaginationService;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.PageCursor;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.CallFilterCriteria;
import com.walkerbrain.portal.modules.transcripts.domain.ColumnGroup;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.ExplorerPageResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Raw analysis rows projected through selected column groups, newest first.
 */
@Service
public class ExplorerService {

    private static final Logger log = LoggerFactory.getLogger(ExplorerService.class);

    public static final int PAGE_SIZE = 50;

    private final CachedQueryExecutor executor;
    private final PaginationService paginationService;
    private final FilterCompiler filterCompiler;
    private final QueryRetrier retrier;

    public ExplorerService(
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

    public ExplorerPageResponse explore(Set<ColumnGroup> groups, CallFilterCriteria criteria, int pageIndex) {
        List<String> columns = ColumnGroup.columnsOf(groups);
        List<FilterSpec> specs = criteria.toFilterSpecs();
        CompiledFilter filter = filterCompiler.compile(specs);

        QueryKey base = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.ROWS)
                .columns(columns)
                .filter(filter)
                .orderBy(SortOrder.desc("analyzed_at"))
                .build();

        QueryResult<Long> total = retrier.withRetry("explorer:count", () -> paginationService.count(base));
        PageCursor cursor = paginationService.forPageIndex(pageIndex, PAGE_SIZE, total.value());
        List<String> groupNames = groupNames(groups);
        if (total.value() == 0) {
            return new ExplorerPageResponse(groupNames, columns, List.of(), cursor, 0, total.cacheStatus());
        }

        QueryKey pageKey = base.withPage(PAGE_SIZE, (int) cursor.offset());
        QueryResult<List<ResultRow>> rows = retrier.withRetry("explorer:page", () -> executor.execute(pageKey));
        long zeroQuality = zeroQualityRows(specs);
        if (zeroQuality > 0) {
            log.debug("Explorer filter matches {} zero-quality rows", zeroQuality);
        }
        return new ExplorerPageResponse(
                groupNames,
                columns,
                rows.value().stream().map(ResultRow::asMap).toList(),
                cursor,
                zeroQuality,
                QuoteBankService.combine(total.cacheStatus(), rows.cacheStatus())
        );
    }

    private long zeroQualityRows(List<FilterSpec> specs) {
        List<FilterSpec> zeroSpecs = new ArrayList<>(specs);
        zeroSpecs.add(FilterSpec.equality("quality_score", 0));
        QueryKey key = QueryKey.builder(TranscriptSources.ANALYSIS_RESULTS, QueryShape.COUNT)
                .filter(filterCompiler.compile(zeroSpecs))
                .build();
        return retrier.withRetry("explorer:zero-quality", () -> paginationService.count(key)).value();
    }

    private static List<String> groupNames(Set<ColumnGroup> groups) {
        List<String> names = new ArrayList<>();
        for (ColumnGroup group : ColumnGroup.values()) {
            if (groups.contains(group)) {
                names.add(group.name());
            }
        }
        return names;
    }
}
