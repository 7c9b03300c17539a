package com.walkerbrain.portal.modules.query.application;

import java.time.Duration;

import com.walkerbrain.portal.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * Store failure surfaced to callers. Never replaced by an empty result.
 */
public class QueryException extends RetryableProblemException {

    private static final Duration RETRY_AFTER = Duration.ofSeconds(5);

    public enum Reason {
        BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true,
                "The data service is temporarily unavailable. Try again shortly."),
        TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, true,
                "The data service took too long to respond. Try again shortly."),
        BAD_FILTER(HttpStatus.BAD_REQUEST, false,
                "The requested filter is not valid.");

        private final HttpStatus status;
        private final boolean retryable;
        private final String message;

        Reason(HttpStatus status, boolean retryable, String message) {
            this.status = status;
            this.retryable = retryable;
            this.message = message;
        }
    }

    private final Reason reason;

    public QueryException(Reason reason, Throwable cause) {
        super(reason.status, reason.name(), reason.message, reason.retryable ? RETRY_AFTER : Duration.ZERO, cause);
        this.reason = reason;
    }

    public QueryException(Reason reason) {
        this(reason, null);
    }

    public Reason getReasonCode() {
        return reason;
    }

    public boolean isRetryable() {
        return reason.retryable;
    }
}
