package com.walkerbrain.portal.modules.transcripts.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.domain.CompiledFilter;
import com.walkerbrain.portal.modules.query.domain.FilterSpec;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.transcripts.domain.TestimonialStatus;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TestimonialResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class TestimonialService {

    private static final Logger log = LoggerFactory.getLogger(TestimonialService.class);

    static final String INVALID_STATUS = "INVALID_TESTIMONIAL_STATUS";
    static final String TESTIMONIAL_NOT_FOUND = "TESTIMONIAL_NOT_FOUND";

    private final CachedQueryExecutor executor;
    private final RelationalStore store;
    private final FilterCompiler filterCompiler;
    private final QueryRetrier retrier;
    private final Clock clock;

    public TestimonialService(
            CachedQueryExecutor executor,
            RelationalStore store,
            FilterCompiler filterCompiler,
            QueryRetrier retrier,
            Clock clock
    ) {
        this.executor = executor;
        this.store = store;
        this.filterCompiler = filterCompiler;
        this.retrier = retrier;
        this.clock = clock;
    }

    public QueryResult<List<TestimonialResponse>> list(String status, String testimonialType) {
        List<FilterSpec> specs = new ArrayList<>();
        if (status != null && !status.isBlank()) {
            specs.add(FilterSpec.equality("status", requireStatus(status).value()));
        }
        if (testimonialType != null && !testimonialType.isBlank()) {
            specs.add(FilterSpec.equality("testimonial_type", testimonialType.trim()));
        }
        QueryKey key = QueryKey.builder(TranscriptSources.TESTIMONIAL_PIPELINE, QueryShape.ROWS)
                .filter(filterCompiler.compile(specs))
                .orderBy(SortOrder.desc("quality_score"))
                .build();
        QueryResult<List<ResultRow>> rows = retrier.withRetry("testimonials:list", () -> executor.execute(key));
        return rows.map(values -> values.stream().map(TestimonialResponse::from).toList());
    }

    /**
     * Moves one testimonial to {@code status}, stamping who did it and when. Notes are only overwritten
     * when supplied.
     */
    public void updateStatus(String sourceTranscriptId, String status, String notes, ViewContext context) {
        TestimonialStatus target = requireStatus(status);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", target.value());
        data.put("status_updated_at", OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
        data.put("status_updated_by", context.actorEmail());
        if (notes != null) {
            data.put("notes", notes);
        }
        CompiledFilter match = filterCompiler.compile(
                List.of(FilterSpec.equality("source_transcript_id", sourceTranscriptId)));

        int updated = executor.write(
                () -> store.update(TranscriptSources.TESTIMONIAL_PIPELINE, data, match.predicates()),
                TranscriptSources.TESTIMONIAL_PIPELINE
        );
        if (updated == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, TESTIMONIAL_NOT_FOUND,
                    "No testimonial for call " + sourceTranscriptId + ".");
        }
        log.info("[Testimonial] {} -> {} by {} (requestId={})",
                sourceTranscriptId, target.value(), context.actorEmail(), context.requestId());
    }

    private static TestimonialStatus requireStatus(String raw) {
        return TestimonialStatus.parse(raw).orElseThrow(() -> new ProblemException(
                HttpStatus.BAD_REQUEST, INVALID_STATUS, "Unknown testimonial status: " + raw + "."));
    }
}
