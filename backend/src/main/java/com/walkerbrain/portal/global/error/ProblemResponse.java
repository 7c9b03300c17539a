package com.walkerbrain.portal.global.error;

import com.walkerbrain.portal.global.web.RequestIdFilter;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * Error body shared by every endpoint. {@code requestId} repeats the {@code X-Request-Id} header so a
 * dashboard user can quote it from the rendered message alone.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                ProblemException.typeFor(safeCode),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode,
                MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)
        );
    }
}
