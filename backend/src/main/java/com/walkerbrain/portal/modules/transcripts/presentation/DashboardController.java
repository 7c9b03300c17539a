package com.walkerbrain.portal.modules.transcripts.presentation;

import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.FilterOptionsService;
import com.walkerbrain.portal.modules.transcripts.application.HighlightsService;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.FilterOptionsResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.HighlightsResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.PipelineStatsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@Tag(name = "Dashboard")
public class DashboardController {

    private final HighlightsService highlightsService;
    private final FilterOptionsService filterOptionsService;

    public DashboardController(HighlightsService highlightsService, FilterOptionsService filterOptionsService) {
        this.highlightsService = highlightsService;
        this.filterOptionsService = filterOptionsService;
    }

    @GetMapping("/dashboard/highlights")
    @Operation(summary = "Period metrics against the prior period, top quotes and daily volume")
    public ResponseEntity<HighlightsResponse> getHighlights(
            @RequestParam(name = "days", defaultValue = "7") @Min(1) @Max(90) int days
    ) {
        HighlightsResponse response = highlightsService.highlights(days);
        return CacheHeaders.ok(response, response.cacheStatus());
    }

    @GetMapping("/dashboard/stats")
    @Operation(summary = "Total analysed calls, first analysis date and pipeline state")
    public ResponseEntity<PipelineStatsResponse> getStats() {
        PipelineStatsResponse response = highlightsService.stats();
        return CacheHeaders.ok(response, response.cacheStatus());
    }

    @GetMapping("/filters/options")
    @Operation(summary = "Values for the case type, tone, outcome and language filters")
    public ResponseEntity<FilterOptionsResponse> getFilterOptions() {
        FilterOptionsResponse response = filterOptionsService.options();
        return CacheHeaders.ok(response, response.cacheStatus());
    }
}
