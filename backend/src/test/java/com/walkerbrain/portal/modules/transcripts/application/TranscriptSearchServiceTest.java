package com.walkerbrain.portal.modules.transcripts.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walkerbrain.portal.modules.query.application.CacheTtlPolicy;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.modules.query.application.QueryRetrier;
import com.walkerbrain.portal.modules.query.application.RelationalStore;
import com.walkerbrain.portal.modules.query.application.RowNormalizer;
import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.infrastructure.cache.CaffeineResultCache;
import com.walkerbrain.portal.modules.transcripts.domain.TranscriptSources;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TranscriptSearchResponse;
import com.walkerbrain.portal.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptSearchServiceTest {

    private RelationalStore store;
    private TranscriptSearchService service;

    @BeforeEach
    void setUp() {
        store = mock(RelationalStore.class);
        RowNormalizer rowNormalizer = new RowNormalizer(new ObjectMapper());
        MutableClock clock = MutableClock.at("2025-03-01T12:00:00Z");
        CachedQueryExecutor executor = new CachedQueryExecutor(
                store,
                new CaffeineResultCache(clock, 100),
                rowNormalizer,
                CacheTtlPolicy.defaults(),
                clock,
                Duration.ofSeconds(2)
        );
        service = new TranscriptSearchService(executor, store, rowNormalizer, new QueryRetrier(0));
    }

    @Test
    void blankKeywordSkipsTheStore() {
        TranscriptSearchResponse response = service.search("   ", 0, 20);

        assertThat(response.results()).isEmpty();
        assertThat(response.cacheStatus()).isEqualTo(CacheStatus.BYPASS);
        verify(store, never()).callProcedure(anyString(), anyMap());
    }

    @Test
    void boundsAreClampedBeforeCallingTheSearchFunction() {
        when(store.callProcedure(eq(TranscriptSources.SEARCH_TRANSCRIPTS), anyMap())).thenReturn(List.of());

        service.search(" whiplash ", 140, 500);

        verify(store).callProcedure(TranscriptSources.SEARCH_TRANSCRIPTS,
                Map.of("query", "whiplash", "min_quality", 100, "max_results", 50));
    }

    @Test
    void repeatedSearchIsServedFromCache() {
        when(store.callProcedure(eq(TranscriptSources.SEARCH_TRANSCRIPTS), anyMap())).thenReturn(List.of(Map.of(
                "source_transcript_id", "call-9",
                "quality_score", 82,
                "headline", "the <b>whiplash</b> kept getting worse")));

        TranscriptSearchResponse first = service.search("whiplash", 50, 10);
        TranscriptSearchResponse second = service.search("whiplash", 50, 10);

        assertThat(first.cacheStatus()).isEqualTo(CacheStatus.MISS);
        assertThat(second.cacheStatus()).isEqualTo(CacheStatus.HIT);
        assertThat(second.results()).singleElement().satisfies(hit -> {
            assertThat(hit.sourceTranscriptId()).isEqualTo("call-9");
            assertThat(hit.caseType()).isEqualTo("Unknown");
        });
        verify(store, times(1)).callProcedure(eq(TranscriptSources.SEARCH_TRANSCRIPTS), anyMap());
    }
}
