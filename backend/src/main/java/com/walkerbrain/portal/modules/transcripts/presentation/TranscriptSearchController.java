package com.walkerbrain.portal.modules.transcripts.presentation;

import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.TranscriptSearchService;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TranscriptSearchResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Transcripts")
public class TranscriptSearchController {

    private final TranscriptSearchService transcriptSearchService;

    public TranscriptSearchController(TranscriptSearchService transcriptSearchService) {
        this.transcriptSearchService = transcriptSearchService;
    }

    @GetMapping("/transcripts/search")
    @Operation(summary = "Full-text keyword search over call transcripts")
    public ResponseEntity<TranscriptSearchResponse> search(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(name = "minQuality", defaultValue = "0") int minQuality,
            @RequestParam(name = "limit", defaultValue = "20") int limit
    ) {
        TranscriptSearchResponse response = transcriptSearchService.search(query, minQuality, limit);
        return CacheHeaders.ok(response, response.cacheStatus());
    }
}
