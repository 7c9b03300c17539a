package com.walkerbrain.portal.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserProfileResponse(
        UUID userId,
        String email,
        String displayName,
        @JsonProperty("isAdmin") boolean isAdmin,
        OffsetDateTime sessionExpiresAt
) {
}
