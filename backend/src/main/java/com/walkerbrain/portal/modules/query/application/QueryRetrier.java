package com.walkerbrain.portal.modules.query.application;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Retries a read on BACKEND_UNAVAILABLE or TIMEOUT before letting the failure reach the client.
 */
@Component
public class QueryRetrier {

    private static final Logger log = LoggerFactory.getLogger(QueryRetrier.class);

    private final int retryAttempts;

    public QueryRetrier(@Value("${app.query.retry-attempts:1}") int retryAttempts) {
        this.retryAttempts = Math.max(0, retryAttempts);
    }

    public <T> T withRetry(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (QueryException ex) {
                if (!ex.isRetryable() || attempt >= retryAttempts) {
                    throw ex;
                }
                attempt++;
                log.warn("[Query][{}] attempt={} failed with {}, retrying", operation, attempt, ex.getReasonCode());
            }
        }
    }
}
