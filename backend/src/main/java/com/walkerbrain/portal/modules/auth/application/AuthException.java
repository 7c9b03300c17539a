package com.walkerbrain.portal.modules.auth.application;

import com.walkerbrain.portal.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Credential and registration failures. Messages are fixed per reason so that a response never tells
 * a caller which half of a credential pair was wrong.
 */
public class AuthException extends ProblemException {

    public enum Reason {
        INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password."),
        DUPLICATE_ACCOUNT(HttpStatus.CONFLICT, "Account already exists. Sign in instead."),
        DOMAIN_RESTRICTED(HttpStatus.UNPROCESSABLE_ENTITY, "Registration is restricted to approved email domains.");

        private final HttpStatus status;
        private final String message;

        Reason(HttpStatus status, String message) {
            this.status = status;
            this.message = message;
        }

        public HttpStatus status() {
            return status;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public AuthException(Reason reason) {
        this(reason, null);
    }

    public AuthException(Reason reason, Throwable cause) {
        super(reason.status(), reason.name(), reason.message(), cause);
        this.reason = reason;
    }

    public Reason getReasonCode() {
        return reason;
    }
}
