package com.walkerbrain.portal.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

/**
 * {@code sessionToken} is also what the client puts in the {@code _session} query parameter.
 */
public record LoginResponse(String sessionToken, OffsetDateTime expiresAt, UserProfileResponse user) {
}
