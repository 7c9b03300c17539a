package com.walkerbrain.portal.modules.transcripts.presentation;

import java.util.List;

import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.SignalsService;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.ObjectionInsightsResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TagBrowserResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TaggedCallResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Signals")
public class SignalsController {

    private final SignalsService signalsService;

    public SignalsController(SignalsService signalsService) {
        this.signalsService = signalsService;
    }

    @GetMapping("/signals/tags")
    @Operation(summary = "Tag taxonomy, or the most used suggested tags when no taxonomy exists")
    public ResponseEntity<TagBrowserResponse> tags(@RequestParam(name = "q", required = false) String search) {
        TagBrowserResponse response = signalsService.tags(search);
        return CacheHeaders.ok(response, response.cacheStatus());
    }

    @GetMapping("/signals/tags/{tag}/calls")
    @Operation(summary = "Best calls carrying a tag")
    public ResponseEntity<List<TaggedCallResponse>> callsWithTag(@PathVariable("tag") String tag) {
        QueryResult<List<TaggedCallResponse>> result = signalsService.callsWithTag(tag);
        return CacheHeaders.ok(result.value(), result.cacheStatus());
    }

    @GetMapping("/signals/objections")
    @Operation(summary = "Objection categories with week-over-week change")
    public ResponseEntity<ObjectionInsightsResponse> objections() {
        ObjectionInsightsResponse response = signalsService.objections();
        return CacheHeaders.ok(response, response.cacheStatus());
    }
}
