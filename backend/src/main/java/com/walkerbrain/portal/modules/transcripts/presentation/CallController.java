package com.walkerbrain.portal.modules.transcripts.presentation;

import java.time.LocalDate;
import java.util.List;

import com.walkerbrain.portal.modules.query.domain.PagedResult;
import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.CallSearchService;
import com.walkerbrain.portal.modules.transcripts.application.QuoteBankService;
import com.walkerbrain.portal.modules.transcripts.domain.CallFilterCriteria;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.CallDetailResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.CallSummaryResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.QuoteResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TranscriptResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Quote bank and call search. Multi-value filters take repeated parameters; leaving one out disables it,
 * sending it empty selects nothing.
 */
@RestController
@Validated
@Tag(name = "Calls")
public class CallController {

    private final QuoteBankService quoteBankService;
    private final CallSearchService callSearchService;

    public CallController(QuoteBankService quoteBankService, CallSearchService callSearchService) {
        this.quoteBankService = quoteBankService;
        this.callSearchService = callSearchService;
    }

    @GetMapping("/quotes")
    @Operation(summary = "Customer quotes, best first")
    public ResponseEntity<PagedResult<QuoteResponse>> getQuotes(
            @RequestParam(name = "caseType", required = false) List<String> caseTypes,
            @RequestParam(name = "tone", required = false) List<String> tones,
            @RequestParam(name = "language", required = false) List<String> languages,
            @RequestParam(name = "minQuality", required = false) Integer minQuality,
            @RequestParam(name = "maxQuality", required = false) Integer maxQuality,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "testimonialOnly", defaultValue = "false") boolean testimonialOnly,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") @Min(1) @Max(100) int size
    ) {
        CallFilterCriteria criteria = new CallFilterCriteria(null, caseTypes, tones, languages, minQuality,
                maxQuality, startDate, endDate, false, false, testimonialOnly);
        PagedResult<QuoteResponse> result = quoteBankService.quotes(criteria, page, size);
        return CacheHeaders.ok(result, result.cacheStatus());
    }

    @GetMapping("/calls")
    @Operation(summary = "Search analysed calls, newest first")
    public ResponseEntity<PagedResult<CallSummaryResponse>> searchCalls(
            @RequestParam(name = "q", required = false) String text,
            @RequestParam(name = "caseType", required = false) List<String> caseTypes,
            @RequestParam(name = "tone", required = false) List<String> tones,
            @RequestParam(name = "language", required = false) List<String> languages,
            @RequestParam(name = "minQuality", required = false) Integer minQuality,
            @RequestParam(name = "maxQuality", required = false) Integer maxQuality,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "hasQuote", defaultValue = "false") boolean hasQuote,
            @RequestParam(name = "contentWorthy", defaultValue = "false") boolean contentWorthy,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") @Min(1) @Max(100) int size
    ) {
        CallFilterCriteria criteria = new CallFilterCriteria(text, caseTypes, tones, languages, minQuality,
                maxQuality, startDate, endDate, hasQuote, contentWorthy, false);
        PagedResult<CallSummaryResponse> result = callSearchService.search(criteria, page, size);
        return CacheHeaders.ok(result, result.cacheStatus());
    }

    @GetMapping("/calls/{sourceTranscriptId}")
    @Operation(summary = "Full analysis of one call")
    public ResponseEntity<CallDetailResponse> getCall(@PathVariable("sourceTranscriptId") String sourceTranscriptId) {
        CallDetailResponse response = callSearchService.detail(sourceTranscriptId);
        return CacheHeaders.ok(response, response.cacheStatus());
    }

    @GetMapping("/calls/{sourceTranscriptId}/transcript")
    @Operation(summary = "Original transcript text of one call")
    public ResponseEntity<TranscriptResponse> getTranscript(
            @PathVariable("sourceTranscriptId") String sourceTranscriptId
    ) {
        return ResponseEntity.ok(callSearchService.transcript(sourceTranscriptId));
    }
}
