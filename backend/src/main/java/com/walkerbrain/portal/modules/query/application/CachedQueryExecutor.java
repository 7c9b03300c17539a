package com.walkerbrain.portal.modules.query.application;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;
import com.walkerbrain.portal.modules.query.domain.QueryShape;
import com.walkerbrain.portal.modules.query.domain.ResultRow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Runs reads through a TTL cache keyed by {@link QueryKey#canonical()}.
 *
 * <p>Concurrent misses on one key share a single store round trip: the first caller registers a future
 * and loads, the rest wait on that future for at most the query timeout. Failures complete the future
 * exceptionally and are never cached. A load that started before an invalidation does not publish its
 * result, so a write is visible to the next read.
 */
@Service
public class CachedQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(CachedQueryExecutor.class);

    private final RelationalStore store;
    private final ResultCache cache;
    private final RowNormalizer rowNormalizer;
    private final CacheTtlPolicy ttlPolicy;
    private final Clock clock;
    private final Duration queryTimeout;

    private final ConcurrentHashMap<String, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong invalidations = new AtomicLong();

    public CachedQueryExecutor(
            RelationalStore store,
            ResultCache cache,
            RowNormalizer rowNormalizer,
            CacheTtlPolicy ttlPolicy,
            Clock clock,
            @Value("${app.query.timeout:PT10S}") Duration queryTimeout
    ) {
        this.store = store;
        this.cache = cache;
        this.rowNormalizer = rowNormalizer;
        this.ttlPolicy = ttlPolicy;
        this.clock = clock;
        this.queryTimeout = queryTimeout;
    }

    /**
     * Row or dictionary read against {@link QueryKey#source()}.
     */
    public QueryResult<List<ResultRow>> execute(QueryKey key) {
        if (key.shape() != QueryShape.ROWS && key.shape() != QueryShape.DICTIONARY) {
            throw new IllegalArgumentException("execute(key) serves ROWS and DICTIONARY keys, got " + key.shape());
        }
        if (key.filter().matchesNothing()) {
            return new QueryResult<>(List.of(), CacheStatus.BYPASS, clock.instant());
        }
        RelationalStore.SelectStatement statement = new RelationalStore.SelectStatement(
                key.source(),
                key.columns(),
                key.filter().predicates(),
                key.order(),
                key.limit(),
                key.offset(),
                key.shape() == QueryShape.DICTIONARY
        );
        return execute(key, () -> rowNormalizer.normalize(store.select(statement)));
    }

    /**
     * Exact count for the key's source and filter; columns, order and pagination are ignored.
     */
    public QueryResult<Long> count(QueryKey key) {
        QueryKey countKey = key.shape() == QueryShape.COUNT ? key : key.forCount();
        if (countKey.filter().matchesNothing()) {
            return new QueryResult<>(0L, CacheStatus.BYPASS, clock.instant());
        }
        return execute(countKey, () -> store.count(countKey.source(), countKey.filter().predicates()));
    }

    /**
     * Caches an arbitrary loader under {@code key}, with the TTL of the key's shape.
     */
    @SuppressWarnings("unchecked")
    public <T> QueryResult<T> execute(QueryKey key, Supplier<T> loader) {
        String cacheKey = key.canonical();
        Optional<CacheEntry> cached = lookup(cacheKey);
        if (cached.isPresent()) {
            log.debug("cache hit {}", cacheKey);
            return new QueryResult<>((T) cached.get().value(), CacheStatus.HIT, cached.get().insertedAt());
        }

        CompletableFuture<CacheEntry> leader = new CompletableFuture<>();
        CompletableFuture<CacheEntry> existing = inFlight.putIfAbsent(cacheKey, leader);
        if (existing != null) {
            CacheEntry shared = awaitLeader(cacheKey, existing);
            return new QueryResult<>((T) shared.value(), CacheStatus.MISS, shared.insertedAt());
        }

        try {
            // a previous leader may have published between our lookup and registration
            Optional<CacheEntry> raced = lookup(cacheKey);
            if (raced.isPresent()) {
                leader.complete(raced.get());
                return new QueryResult<>((T) raced.get().value(), CacheStatus.HIT, raced.get().insertedAt());
            }

            long generation = invalidations.get();
            T value = load(cacheKey, loader);
            CacheEntry entry = new CacheEntry(value, clock.instant(), ttlPolicy.ttlFor(key.shape()));
            publish(cacheKey, entry, generation);
            leader.complete(entry);
            log.debug("cache miss {}", cacheKey);
            return new QueryResult<>(value, CacheStatus.MISS, entry.insertedAt());
        } catch (RuntimeException ex) {
            leader.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(cacheKey, leader);
        }
    }

    /**
     * Runs a store write and then invalidates every listed source, so the next read reflects it.
     *
     * <p>Inside a transaction the invalidation waits for the commit; a read between the write and the
     * commit still sees committed rows, and anything it caches is dropped once the commit lands.
     */
    public int write(Supplier<Integer> writer, String... affectedSources) {
        int affected;
        try {
            affected = writer.get();
        } catch (DataAccessException ex) {
            QueryException translated = translate(ex);
            log.warn("store write failed: {}", translated.getReasonCode(), ex);
            throw translated;
        }
        List<String> sources = List.of(affectedSources);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    invalidateSources(sources);
                }
            });
            log.debug("invalidation of {} deferred until commit", sources);
        } else {
            invalidateSources(sources);
        }
        return affected;
    }

    /**
     * Drops every cached entry whose canonical key starts with {@code prefix}, typically a table name.
     *
     * @return number of removed entries
     */
    public int invalidate(String prefix) {
        invalidations.incrementAndGet();
        inFlight.keySet().removeIf(key -> key.startsWith(prefix));
        try {
            int removed = cache.invalidatePrefix(prefix);
            log.debug("invalidated {} cache entries for prefix {}", removed, prefix);
            return removed;
        } catch (CacheException ex) {
            log.warn("cache invalidation failed for prefix {}; clearing cache", prefix, ex);
            return invalidateAll();
        }
    }

    private void invalidateSources(List<String> sources) {
        for (String source : sources) {
            invalidate(source + "|");
        }
    }

    public int invalidateAll() {
        invalidations.incrementAndGet();
        inFlight.clear();
        int removed = cache.clear();
        log.info("cleared {} cache entries", removed);
        return removed;
    }

    public int cachedEntries() {
        return cache.size();
    }

    private <T> T load(String cacheKey, Supplier<T> loader) {
        try {
            return loader.get();
        } catch (QueryException | FilterException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            QueryException translated = translate(ex);
            log.warn("store read failed for {}: {}", cacheKey, translated.getReasonCode(), ex);
            throw translated;
        }
    }

    private CacheEntry awaitLeader(String cacheKey, CompletableFuture<CacheEntry> leader) {
        try {
            return leader.get(queryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new QueryException(QueryException.Reason.TIMEOUT, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new QueryException(QueryException.Reason.BACKEND_UNAVAILABLE, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            log.warn("shared load for {} failed", cacheKey, cause);
            throw new QueryException(QueryException.Reason.BACKEND_UNAVAILABLE, cause);
        }
    }

    private Optional<CacheEntry> lookup(String cacheKey) {
        try {
            return cache.get(cacheKey, clock.instant());
        } catch (CacheException ex) {
            log.warn("cache read failed for {}; falling back to store", cacheKey, ex);
            return Optional.empty();
        }
    }

    /**
     * Stores a loaded entry unless an invalidation ran since {@code generation} was read. The generation
     * is checked again after the put because an invalidation can land between the first check and the
     * put; the entry is then withdrawn.
     */
    private void publish(String cacheKey, CacheEntry entry, long generation) {
        if (generation != invalidations.get()) {
            log.debug("skip publishing {} after concurrent invalidation", cacheKey);
            return;
        }
        try {
            cache.put(cacheKey, entry);
            if (generation != invalidations.get() && cache.remove(cacheKey, entry)) {
                log.debug("withdrew {} after concurrent invalidation", cacheKey);
            }
        } catch (CacheException ex) {
            log.warn("cache write failed for {}", cacheKey, ex);
        }
    }

    static QueryException translate(DataAccessException ex) {
        if (ex instanceof QueryTimeoutException) {
            return new QueryException(QueryException.Reason.TIMEOUT, ex);
        }
        if (ex instanceof BadSqlGrammarException || ex instanceof InvalidDataAccessApiUsageException) {
            return new QueryException(QueryException.Reason.BAD_FILTER, ex);
        }
        // transient failures, lost connections and anything unrecognised
        return new QueryException(QueryException.Reason.BACKEND_UNAVAILABLE, ex);
    }
}
