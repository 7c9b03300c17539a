package com.walkerbrain.portal.modules.query.presentation;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;

import org.springframework.http.ResponseEntity;

/**
 * Surfaces cache freshness to clients through the {@code X-Cache} response header.
 */
public final class CacheHeaders {

    public static final String X_CACHE = "X-Cache";

    private CacheHeaders() {
    }

    public static <T> ResponseEntity<T> ok(T body, CacheStatus status) {
        return ResponseEntity.ok()
                .header(X_CACHE, status.name())
                .body(body);
    }
}
