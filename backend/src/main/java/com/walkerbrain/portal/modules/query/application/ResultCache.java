package com.walkerbrain.portal.modules.query.application;

import java.time.Instant;
import java.util.Optional;

/**
 * Key/value store behind {@link CachedQueryExecutor}. Implementations may throw {@link CacheException};
 * the executor treats that as a miss.
 */
public interface ResultCache {

    /**
     * Returns the entry if still fresh at {@code now}; an expired entry is evicted on this call.
     */
    Optional<CacheEntry> get(String key, Instant now);

    void put(String key, CacheEntry entry);

    /**
     * Removes {@code key} only while it still maps to {@code entry}.
     */
    boolean remove(String key, CacheEntry entry);

    /**
     * @return number of removed entries
     */
    int invalidatePrefix(String prefix);

    int clear();

    int size();
}
