package com.walkerbrain.portal.global.web;

import java.time.OffsetDateTime;
import java.util.Objects;

import com.walkerbrain.portal.global.security.SessionAuthenticationPrincipal;

/**
 * Per-request view state handed explicitly to services.
 * Created when a request enters a controller and dropped when the response is written.
 */
public record ViewContext(SessionAuthenticationPrincipal principal, String requestId, OffsetDateTime receivedAt) {

    public ViewContext {
        Objects.requireNonNull(principal, "principal must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    }

    public String actorEmail() {
        return principal.email();
    }

    public boolean isAdmin() {
        return principal.admin();
    }
}
