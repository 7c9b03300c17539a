package com.walkerbrain.portal.modules.transcripts.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.modules.query.application.CacheTtlPolicy;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.FilterCompiler;
import com.walkerbrain.portal.modules.query.application.PaginationService;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.application.RowNormalizer;
import com.walkerbrain.portal.modules.query.domain.PredicateOperator;
import com.walkerbrain.portal.modules.query.domain.SortOrder;
import com.walkerbrain.portal.modules.query.domain.StorePredicate;
import com.walkerbrain.portal.modules.query.infrastructure.cache.CaffeineResultCache;
import com.walkerbrain.portal.modules.transcripts.domain.CallFilterCriteria;
import com.walkerbrain.portal.modules.transcripts.domain.ColumnGroup;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.ExplorerPageResponse;
import com.walkerbrain.portal.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;

class ExplorerServiceTest {

    private RelationalStore store;
    private ExplorerService service;

    @BeforeEach
    void setUp() {
        store = mock(RelationalStore.class);
        MutableClock clock = MutableClock.at("2025-03-01T12:00:00Z");
        CachedQueryExecutor executor = new CachedQueryExecutor(
                store,
                new CaffeineResultCache(clock, 100),
                new RowNormalizer(new ObjectMapper()),
                CacheTtlPolicy.defaults(),
                clock,
                Duration.ofSeconds(2)
        );
        service = new ExplorerService(executor, new PaginationService(executor), new FilterCompiler(),
                new QueryRetrier(0));
    }

    @Test
    void pageProjectsSelectedGroupsNewestFirst() {
        when(store.count(eq(TranscriptSources.ANALYSIS_RESULTS), anyList())).thenReturn(120L, 3L);
        when(store.select(any())).thenReturn(List.of(row("call-51", 0), row("call-52", 88)));

        ExplorerPageResponse response = service.explore(
                EnumSet.of(ColumnGroup.METADATA, ColumnGroup.CORE), CallFilterCriteria.none(), 1);

        ArgumentCaptor<RelationalStore.SelectStatement> statement =
                ArgumentCaptor.forClass(RelationalStore.SelectStatement.class);
        verify(store).select(statement.capture());
        assertThat(statement.getValue().columns())
                .startsWith("source_transcript_id", "case_type")
                .endsWith("output_tokens", "analysis_type")
                .hasSize(ColumnGroup.CORE.getColumns().size() + ColumnGroup.METADATA.getColumns().size());
        assertThat(statement.getValue().order()).containsExactly(SortOrder.desc("analyzed_at"));
        assertThat(statement.getValue().limit()).isEqualTo(ExplorerService.PAGE_SIZE);
        assertThat(statement.getValue().offset()).isEqualTo(50);

        assertThat(response.groups()).containsExactly("CORE", "METADATA");
        assertThat(response.rows()).extracting(values -> values.get("source_transcript_id"))
                .containsExactly("call-51", "call-52");
        assertThat(response.page().totalCount()).isEqualTo(120);
        assertThat(response.page().totalPages()).isEqualTo(3);
        assertThat(response.zeroQualityRows()).isEqualTo(3);
    }

    @Test
    void zeroQualityCountAddsScoreConditionToTheFilter() {
        when(store.count(eq(TranscriptSources.ANALYSIS_RESULTS), anyList())).thenReturn(10L, 0L);
        when(store.select(any())).thenReturn(List.of(row("call-1", 75)));

        service.explore(EnumSet.of(ColumnGroup.CORE), CallFilterCriteria.none(), 0);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StorePredicate>> predicates = ArgumentCaptor.forClass(List.class);
        verify(store, times(2)).count(eq(TranscriptSources.ANALYSIS_RESULTS), predicates.capture());
        assertThat(predicates.getAllValues().get(1))
                .contains(StorePredicate.of("quality_score", PredicateOperator.EQ, 0));
    }

    @Test
    void emptyMatchSkipsThePageRead() {
        when(store.count(eq(TranscriptSources.ANALYSIS_RESULTS), anyList())).thenReturn(0L);

        ExplorerPageResponse response = service.explore(EnumSet.of(ColumnGroup.CORE), CallFilterCriteria.none(), 4);

        assertThat(response.rows()).isEmpty();
        assertThat(response.page().pageIndex()).isZero();
        verify(store, never()).select(any());
    }

    @Test
    void emptyGroupSelectionIsRejected() {
        assertThatThrownBy(() -> service.explore(EnumSet.noneOf(ColumnGroup.class), CallFilterCriteria.none(), 0))
                .isInstanceOfSatisfying(ProblemException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(e.getCode()).isEqualTo("NO_COLUMN_GROUP");
                });
        verify(store, never()).count(any(), anyList());
    }

    @Test
    void groupNamesAcceptHyphensAndAnyCase() {
        assertThat(ColumnGroup.from("language-and-culture")).isEqualTo(ColumnGroup.LANGUAGE_AND_CULTURE);
        assertThat(ColumnGroup.from(" cx_intelligence ")).isEqualTo(ColumnGroup.CX_INTELLIGENCE);
        assertThatThrownBy(() -> ColumnGroup.from("transcripts"))
                .isInstanceOfSatisfying(ProblemException.class,
                        e -> assertThat(e.getCode()).isEqualTo("UNKNOWN_COLUMN_GROUP"));
    }

    private static Map<String, Object> row(String id, int quality) {
        Map<String, Object> row = new HashMap<>();
        row.put("source_transcript_id", id);
        row.put("case_type", "Auto Accident");
        row.put("quality_score", quality);
        row.put("analyzed_at", OffsetDateTime.parse("2025-02-28T10:00:00Z"));
        return row;
    }
}
