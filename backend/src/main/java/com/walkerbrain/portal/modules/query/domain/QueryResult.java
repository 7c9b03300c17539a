package com.walkerbrain.portal.modules.query.domain;

import java.time.Instant;
import java.util.function.Function;

public record QueryResult<T>(T value, CacheStatus cacheStatus, Instant fetchedAt) {

    public boolean isHit() {
        return cacheStatus == CacheStatus.HIT;
    }

    public <R> QueryResult<R> map(Function<? super T, ? extends R> mapper) {
        return new QueryResult<>(mapper.apply(value), cacheStatus, fetchedAt);
    }
}
