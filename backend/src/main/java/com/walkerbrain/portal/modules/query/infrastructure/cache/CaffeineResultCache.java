package com.walkerbrain.portal.modules.query.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.walkerbrain.portal.modules.query.application.CacheEntry;
import com.walkerbrain.portal.modules.query.application.ResultCache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-local result cache backed by Caffeine.
 *
 * <p>Each entry expires after the TTL it was stored with, measured on the application clock, and the
 * cache never holds more than {@code app.cache.max-entries} entries. Maintenance runs on the calling
 * thread so size and expiry are settled when a call returns.
 */
@Component
public class CaffeineResultCache implements ResultCache {

    private final Clock clock;
    private final long maxEntries;
    private final Cache<String, CacheEntry> entries;

    public CaffeineResultCache(Clock clock, @Value("${app.cache.max-entries:5000}") long maxEntries) {
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
        this.entries = Caffeine.newBuilder()
                .maximumSize(this.maxEntries)
                .expireAfter(new EntryTtlExpiry(clock))
                .ticker(() -> toNanos(clock.instant()))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<CacheEntry> get(String key, Instant now) {
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isFreshAt(now)) {
            entries.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(String key, CacheEntry entry) {
        entries.put(key, entry);
    }

    @Override
    public boolean remove(String key, CacheEntry entry) {
        return entries.asMap().remove(key, entry);
    }

    @Override
    public int invalidatePrefix(String prefix) {
        List<String> matching = new ArrayList<>();
        for (String key : entries.asMap().keySet()) {
            if (key.startsWith(prefix)) {
                matching.add(key);
            }
        }
        int removed = 0;
        for (String key : matching) {
            if (entries.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int clear() {
        int size = size();
        entries.invalidateAll();
        entries.cleanUp();
        return size;
    }

    @Override
    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    public long maxEntries() {
        return maxEntries;
    }

    private static long toNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    /**
     * Expires an entry at {@code insertedAt + ttl}; reads do not extend it.
     */
    private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {

        private final Clock clock;

        private EntryTtlExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return remaining(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return remaining(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remaining(CacheEntry entry) {
            Duration left = Duration.between(clock.instant(), entry.insertedAt().plus(entry.ttl()));
            return left.isNegative() ? 0L : left.toNanos();
        }
    }
}
