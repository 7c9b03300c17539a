package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateTestimonialStatusRequest(
        @NotBlank(message = "status is required") String status,
        @Size(max = 2000, message = "notes is too long") String notes
) {
}
