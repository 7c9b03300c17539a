package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record AngleFeedbackRequest(
        @NotBlank(message = "verdict is required")
        @Pattern(regexp = "approve|reject|revise", message = "verdict must be approve, reject or revise")
        String verdict,
        @Size(max = 2000, message = "note is too long") String note
) {
}
