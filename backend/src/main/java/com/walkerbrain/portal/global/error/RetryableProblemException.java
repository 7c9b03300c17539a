package com.walkerbrain.portal.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * A failure the caller may repeat unchanged. A positive {@code retryAfter} is sent as {@code Retry-After}
 * in whole seconds, rounded up.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter, Throwable cause) {
        super(status, code, detail, cause);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be zero or positive");
        }
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean hasRetryAfter() {
        return !retryAfter.isZero();
    }

    public String retryAfterHeaderValue() {
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return String.valueOf(seconds);
    }
}
