package com.walkerbrain.portal.modules.query.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class QueryRetrierTest {

    @Test
    void retriesTransientFailureOnce() {
        AtomicInteger calls = new AtomicInteger();

        String value = new QueryRetrier(1).withRetry("test", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new QueryException(QueryException.Reason.BACKEND_UNAVAILABLE);
            }
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
        assertThat(calls).hasValue(2);
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> new QueryRetrier(1).withRetry("test", () -> {
            calls.incrementAndGet();
            throw new QueryException(QueryException.Reason.TIMEOUT);
        }))
                .isInstanceOfSatisfying(QueryException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(QueryException.Reason.TIMEOUT));
        assertThat(calls).hasValue(2);
    }

    @Test
    void badFilterIsNeverRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> new QueryRetrier(3).withRetry("test", () -> {
            calls.incrementAndGet();
            throw new QueryException(QueryException.Reason.BAD_FILTER);
        })).isInstanceOf(QueryException.class);
        assertThat(calls).hasValue(1);
    }
}
