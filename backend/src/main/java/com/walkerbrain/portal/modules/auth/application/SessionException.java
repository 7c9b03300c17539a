package com.walkerbrain.portal.modules.auth.application;

import com.walkerbrain.portal.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Both reasons render identically to clients; the reason is kept for logging.
 */
public class SessionException extends ProblemException {

    public static final String CODE = "SESSION_INVALID";
    private static final String MESSAGE = "Your session has ended. Sign in again.";

    public enum Reason {
        EXPIRED,
        NOT_FOUND
    }

    private final Reason reason;

    public SessionException(Reason reason) {
        super(HttpStatus.UNAUTHORIZED, CODE, MESSAGE);
        this.reason = reason;
    }

    public Reason getReasonCode() {
        return reason;
    }
}
