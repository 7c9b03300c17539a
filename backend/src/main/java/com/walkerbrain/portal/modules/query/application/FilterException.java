package com.walkerbrain.portal.modules.query.application;

import com.walkerbrain.portal.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class FilterException extends ProblemException {

    public enum Reason {
        OUT_OF_RANGE,
        EMPTY_MEMBERSHIP
    }

    private final Reason reason;

    public FilterException(Reason reason, String detail) {
        super(HttpStatus.BAD_REQUEST, reason.name(), detail);
        this.reason = reason;
    }

    public Reason getReasonCode() {
        return reason;
    }
}
