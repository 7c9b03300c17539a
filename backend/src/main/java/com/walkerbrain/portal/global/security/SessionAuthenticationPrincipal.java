package com.walkerbrain.portal.global.security;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Authenticated view of a session. {@code displayName} is the snapshot copied when the session was
 * created; {@code admin} is the owner's flag as read when the session was last validated.
 */
public record SessionAuthenticationPrincipal(
        UUID userId,
        String email,
        String displayName,
        boolean admin,
        OffsetDateTime sessionExpiresAt
) {

    public static final String ROLE_USER = "USER";
    public static final String ROLE_ADMIN = "ADMIN";

    public List<String> roles() {
        return admin ? List.of(ROLE_USER, ROLE_ADMIN) : List.of(ROLE_USER);
    }
}
