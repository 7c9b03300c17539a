package com.walkerbrain.portal.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    static final String TYPE_PREFIX = "urn:walkerbrain:problem:";

    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.type = typeFor(code);
    }

    /**
     * Problem type URI for a code, e.g. {@code SESSION_INVALID} becomes
     * {@code urn:walkerbrain:problem:session-invalid}.
     */
    public static String typeFor(String code) {
        return TYPE_PREFIX + code.toLowerCase().replaceAll("[^a-z0-9.]+", "-");
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
