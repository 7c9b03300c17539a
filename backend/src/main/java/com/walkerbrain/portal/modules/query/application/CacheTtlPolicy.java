package com.walkerbrain.portal.modules.query.application;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import com.walkerbrain.portal.modules.query.domain.QueryShape;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class CacheTtlPolicy {

    private final Map<QueryShape, Duration> ttls = new EnumMap<>(QueryShape.class);

    public CacheTtlPolicy(
            @Value("${app.cache.ttl.dictionary:PT1H}") Duration dictionary,
            @Value("${app.cache.ttl.rows:PT5M}") Duration rows,
            @Value("${app.cache.ttl.count:PT5M}") Duration count,
            @Value("${app.cache.ttl.aggregate:PT10M}") Duration aggregate
    ) {
        ttls.put(QueryShape.DICTIONARY, dictionary);
        ttls.put(QueryShape.ROWS, rows);
        ttls.put(QueryShape.COUNT, count);
        ttls.put(QueryShape.AGGREGATE, aggregate);
    }

    public static CacheTtlPolicy defaults() {
        return new CacheTtlPolicy(Duration.ofHours(1), Duration.ofMinutes(5), Duration.ofMinutes(5), Duration.ofMinutes(10));
    }

    public Duration ttlFor(QueryShape shape) {
        return ttls.get(shape);
    }
}
