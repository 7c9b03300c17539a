package com.walkerbrain.portal.modules.transcripts.presentation;

import java.util.List;

import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.TestimonialService;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.TestimonialResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.UpdateTestimonialStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/testimonials")
@Tag(name = "Testimonials")
public class TestimonialController {

    private final TestimonialService testimonialService;

    public TestimonialController(TestimonialService testimonialService) {
        this.testimonialService = testimonialService;
    }

    @GetMapping
    @Operation(summary = "Testimonial candidates, best first")
    public ResponseEntity<List<TestimonialResponse>> getTestimonials(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "type", required = false) String type
    ) {
        QueryResult<List<TestimonialResponse>> result = testimonialService.list(status, type);
        return CacheHeaders.ok(result.value(), result.cacheStatus());
    }

    @PatchMapping("/{sourceTranscriptId}/status")
    @Operation(summary = "Move a testimonial to another pipeline stage")
    public ResponseEntity<Void> updateStatus(
            @PathVariable("sourceTranscriptId") String sourceTranscriptId,
            @Valid @RequestBody UpdateTestimonialStatusRequest request,
            ViewContext context
    ) {
        testimonialService.updateStatus(sourceTranscriptId, request.status(), request.notes(), context);
        return ResponseEntity.noContent().build();
    }
}
