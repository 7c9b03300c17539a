package com.walkerbrain.portal.modules.query.application;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(Object value, Instant insertedAt, Duration ttl) {

    public boolean isFreshAt(Instant now) {
        return now.isBefore(insertedAt.plus(ttl));
    }
}
