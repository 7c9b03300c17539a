package com.walkerbrain.portal.modules.transcripts.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.PaginationService;
import com.walkerbrain.portal.modules.query.application.PredicateEvaluator;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.PageCursor;
import com.walkerbrain.portal.modules.query.domain.PagedResult;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.AngleFilterCriteria;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AngleBankResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AngleResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generated creative angles awaiting review. The store returns at most {@link #FETCH_LIMIT} newest rows;
 * content intent lives in the JSON payload and is filtered after the fetch, so pagination happens in
 * memory.
 */
@Service
public class AngleBankService {

    private static final Logger log = LoggerFactory.getLogger(AngleBankService.class);

    static final int FETCH_LIMIT = 200;
    static final int PAGE_SIZE = 20;
    static final String ANGLE_NOT_FOUND = "ANGLE_NOT_FOUND";
    static final String APPROVE = "approve";

    private final CachedQueryExecutor executor;
    private final RelationalStore store;
    private final PaginationService paginationService;
    private final FilterCompiler filterCompiler;
    private final PredicateEvaluator predicateEvaluator;
    private final QueryRetrier retrier;
    private final Clock clock;

    public AngleBankService(
            CachedQueryExecutor executor,
            RelationalStore store,
            PaginationService paginationService,
            FilterCompiler filterCompiler,
            PredicateEvaluator predicateEvaluator,
            QueryRetrier retrier,
            Clock clock
    ) {
        this.executor = executor;
        this.store = store;
        this.paginationService = paginationService;
        this.filterCompiler = filterCompiler;
        this.predicateEvaluator = predicateEvaluator;
        this.retrier = retrier;
        this.clock = clock;
    }

    public AngleBankResponse angles(AngleFilterCriteria criteria, int pageIndex) {
        List<FilterSpec> specs = new ArrayList<>();
        specs.add(FilterSpec.membership("status", criteria.effectiveStatuses()));
        if (criteria.contentTypes() != null) {
            specs.add(FilterSpec.membership("content_type", criteria.contentTypes()));
        }
        specs.add(FilterSpec.range("quality_score",
                criteria.minQuality() == null ? 0 : criteria.minQuality(),
                criteria.maxQuality() == null ? 100 : criteria.maxQuality()));
        if (criteria.startDate() != null || criteria.endDate() != null) {
            specs.add(FilterSpec.calendarDays("created_at", criteria.startDate(), criteria.endDate()));
        }
        QueryKey key = QueryKey.builder(TranscriptSources.CONTENT_GENERATION_QUEUE, QueryShape.ROWS)
                .filter(filterCompiler.compile(specs))
                .orderBy(SortOrder.desc("created_at"))
                .limit(FETCH_LIMIT)
                .build();
        QueryResult<List<ResultRow>> rows = retrier.withRetry("angles:list", () -> executor.execute(key));

        List<ResultRow> filtered = filterByIntent(rows.value(), criteria.intents());
        PageCursor cursor = paginationService.forPageIndex(pageIndex, PAGE_SIZE, filtered.size());
        int from = (int) cursor.offset();
        int to = Math.min(filtered.size(), from + PAGE_SIZE);
        List<AngleResponse> page = filtered.subList(from, to).stream().map(AngleResponse::from).toList();
        return new AngleBankResponse(
                new PagedResult<>(page, cursor, rows.cacheStatus()),
                summarize(filtered)
        );
    }

    /**
     * Records one reviewer's verdict on an angle; a second verdict from the same reviewer replaces the
     * first. Approval also moves the angle to {@code approved}.
     */
    @Transactional
    public void feedback(long angleId, String verdict, String note, ViewContext context) {
        CompiledFilter byId = filterCompiler.compile(List.of(FilterSpec.equality("id", angleId)));
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);

        Map<String, Object> feedback = new LinkedHashMap<>();
        feedback.put("angle_id", angleId);
        feedback.put("user_email", context.actorEmail());
        feedback.put("verdict", verdict);
        feedback.put("note", note == null ? "" : note);
        feedback.put("updated_at", now);

        executor.write(() -> {
            if (store.count(TranscriptSources.CONTENT_GENERATION_QUEUE, byId.predicates()) == 0) {
                throw new ProblemException(HttpStatus.NOT_FOUND, ANGLE_NOT_FOUND, "No angle with id " + angleId + ".");
            }
            int written = store.upsert(TranscriptSources.ANGLE_FEEDBACK, feedback, List.of("angle_id", "user_email"));
            if (APPROVE.equals(verdict)) {
                written += store.update(TranscriptSources.CONTENT_GENERATION_QUEUE,
                        Map.of("status", "approved"), byId.predicates());
            }
            return written;
        }, TranscriptSources.CONTENT_GENERATION_QUEUE, TranscriptSources.ANGLE_FEEDBACK);
        log.info("[AngleBank] angle={} verdict={} by {} (requestId={})",
                angleId, verdict, context.actorEmail(), context.requestId());
    }

    List<ResultRow> filterByIntent(List<ResultRow> rows, List<String> intents) {
        if (intents == null) {
            return rows;
        }
        CompiledFilter intentFilter = filterCompiler.compile(List.of(FilterSpec.membership("content_intent", intents)));
        List<ResultRow> matched = new ArrayList<>();
        for (ResultRow row : rows) {
            Map<String, Object> enriched = new LinkedHashMap<>(row.asMap());
            enriched.put("content_intent", row.getMap("content_text").get("content_intent"));
            if (predicateEvaluator.matches(new ResultRow(enriched), intentFilter)) {
                matched.add(row);
            }
        }
        return matched;
    }

    static AngleBankResponse.Summary summarize(List<ResultRow> rows) {
        long pending = 0;
        long approved = 0;
        Map<String, Long> byContentType = new TreeMap<>();
        for (ResultRow row : rows) {
            String status = row.getString("status");
            if ("pending_review".equals(status)) {
                pending++;
            } else if ("approved".equals(status)) {
                approved++;
            }
            String contentType = row.has("content_type") ? row.getString("content_type") : "other";
            byContentType.merge(contentType, 1L, Long::sum);
        }
        return new AngleBankResponse.Summary(rows.size(), pending, approved, byContentType);
    }
}
