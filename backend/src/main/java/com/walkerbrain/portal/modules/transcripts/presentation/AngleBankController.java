package com.walkerbrain.portal.modules.transcripts.presentation;

import java.time.LocalDate;
import java.util.List;

import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.AngleBankService;
import com.walkerbrain.portal.modules.transcripts.domain.AngleFilterCriteria;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AngleBankResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AngleFeedbackRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/angles")
@Tag(name = "Angle Bank")
public class AngleBankController {

    private final AngleBankService angleBankService;

    public AngleBankController(AngleBankService angleBankService) {
        this.angleBankService = angleBankService;
    }

    @GetMapping
    @Operation(summary = "Generated creative angles, newest first, 20 per page")
    public ResponseEntity<AngleBankResponse> getAngles(
            @RequestParam(name = "status", required = false) List<String> statuses,
            @RequestParam(name = "contentType", required = false) List<String> contentTypes,
            @RequestParam(name = "intent", required = false) List<String> intents,
            @RequestParam(name = "minQuality", required = false) Integer minQuality,
            @RequestParam(name = "maxQuality", required = false) Integer maxQuality,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "page", defaultValue = "0") int page
    ) {
        AngleFilterCriteria criteria = new AngleFilterCriteria(statuses, contentTypes, intents, minQuality,
                maxQuality, startDate, endDate);
        AngleBankResponse response = angleBankService.angles(criteria, page);
        return CacheHeaders.ok(response, response.angles().cacheStatus());
    }

    @PostMapping("/{angleId}/feedback")
    @Operation(summary = "Approve, reject or ask for a revision of an angle")
    public ResponseEntity<Void> submitFeedback(
            @PathVariable("angleId") long angleId,
            @Valid @RequestBody AngleFeedbackRequest request,
            ViewContext context
    ) {
        angleBankService.feedback(angleId, request.verdict(), request.note(), context);
        return ResponseEntity.noContent().build();
    }
}
