package com.o2o.analytics.infrastructure.cache;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.exception.EngineException;
import com.o2o.analytics.domain.exception.ErrorCodes;
import com.o2o.analytics.domain.exception.QueryTimeoutException;
import com.o2o.analytics.domain.service.DataVersionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Query result cache keyed by (key, data version).
 *
 * Protection:
 * - Version check: an entry computed at another data version is a miss, whatever its TTL
 * - Penetration: empty results are cached too, with a short TTL
 * - Stampede: one computation per (key, version); concurrent callers wait for it
 *   and receive its value or its exception
 * - Avalanche: TTLs are jittered so entries written together do not expire together
 *
 * Eviction is left to the {@link CacheStore} (entry bound, TTL).
 */
@Slf4j
@Component
public class VersionedQueryCache {

    static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final CacheStore store;
    private final DataVersionRegistry versions;
    private final EngineProperties.CacheProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong staleVersionMisses = new AtomicLong();
    private final AtomicLong emptyHits = new AtomicLong();
    private final AtomicLong computes = new AtomicLong();
    private final AtomicLong singleFlightWaits = new AtomicLong();

    public VersionedQueryCache(CacheStore store, DataVersionRegistry versions, EngineProperties engineProperties,
                               MeterRegistry meterRegistry, Clock clock) {
        this.store = store;
        this.versions = versions;
        this.properties = engineProperties.getCache();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Cached value of {@code key} at the definition's current data version.
     */
    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        return lookup(key, versions.current(key.getDefinitionId()), type, true).map(CacheEntry::getValue);
    }

    /**
     * Returns the cached value for (key, version) or computes it exactly once.
     *
     * @param ttl     TTL for non-empty results, before jitter
     * @param isEmpty decides whether a result gets the short empty TTL
     * @throws QueryTimeoutException when waiting on another caller's computation exceeds the compute timeout
     */
    public <T> T getOrCompute(CacheKey key, long version, Duration ttl, Class<T> type,
                              Supplier<T> compute, Predicate<T> isEmpty) {
        Optional<CacheEntry<T>> cached = lookup(key, version, type, true);
        if (cached.isPresent()) {
            return cached.get().getValue();
        }

        String flightKey = render(key) + "@" + version;
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> running = inFlight.putIfAbsent(flightKey, mine);
        if (running != null) {
            singleFlightWaits.incrementAndGet();
            log.debug("Waiting for in-flight computation of {}", flightKey);
            return type.cast(await(running, flightKey));
        }

        try {
            // a computation may have finished between the lookup and the registration
            Optional<CacheEntry<T>> again = lookup(key, version, type, false);
            if (again.isPresent()) {
                mine.complete(again.get().getValue());
                return again.get().getValue();
            }

            computes.incrementAndGet();
            T value = compute.get();
            store(key, version, value, value == null || isEmpty.test(value), ttl);
            mine.complete(value);
            return value;
        } catch (Throwable e) {
            // waiters are released on errors too
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(flightKey, mine);
        }
    }

    public void invalidate(CacheKey key) {
        store.evict(render(key));
    }

    /**
     * Evicts every entry of a definition.
     *
     * @return number of entries removed
     */
    public long invalidateDefinition(String definitionId) {
        long evicted = store.evictByPrefix(CacheKey.definitionPrefix(properties.getKeyPrefix(), definitionId));
        log.info("Invalidated {} cache entries of {}", evicted, definitionId);
        return evicted;
    }

    public CacheStats stats() {
        return CacheStats.builder()
                .hits(hits.get())
                .misses(misses.get())
                .staleVersionMisses(staleVersionMisses.get())
                .emptyHits(emptyHits.get())
                .computes(computes.get())
                .singleFlightWaits(singleFlightWaits.get())
                .size(store.size())
                .build();
    }

    Duration jitteredTtl(Duration ttl) {
        long jitterMs = properties.getJitter().toMillis();
        if (jitterMs <= 0) {
            return ttl;
        }
        long offset = ThreadLocalRandom.current().nextLong(-jitterMs, jitterMs + 1);
        return Duration.ofMillis(Math.max(ttl.toMillis() + offset, MIN_TTL.toMillis()));
    }

    private <T> Optional<CacheEntry<T>> lookup(CacheKey key, long version, Class<T> type, boolean record) {
        Optional<CacheEntry<T>> entry = store.get(render(key), type);
        if (entry.isPresent() && entry.get().getDataVersion() == version) {
            if (record) {
                hits.incrementAndGet();
                if (entry.get().isEmpty()) {
                    emptyHits.incrementAndGet();
                }
                count("hit");
                log.debug("Cache hit for query: {}", key);
            }
            return entry;
        }
        if (record) {
            misses.incrementAndGet();
            if (entry.isPresent()) {
                staleVersionMisses.incrementAndGet();
                log.debug("Cache entry for {} is at version {}, current {}", key, entry.get().getDataVersion(), version);
            } else {
                log.debug("Cache miss for query: {}", key);
            }
            count("miss");
        }
        return Optional.empty();
    }

    private <T> void store(CacheKey key, long version, T value, boolean empty, Duration ttl) {
        Duration effectiveTtl = empty ? properties.getEmptyTtl() : jitteredTtl(ttl);
        CacheEntry<T> entry = CacheEntry.<T>builder()
                .value(value)
                .empty(empty)
                .dataVersion(version)
                .expiresAt(clock.instant().plus(effectiveTtl))
                .build();
        try {
            store.put(render(key), entry);
        } catch (RuntimeException e) {
            // a failed cache write must not fail the query
            log.error("Error writing to cache: {}", e.getMessage());
        }
    }

    private Object await(CompletableFuture<Object> running, String flightKey) {
        long timeoutMs = properties.getComputeTimeout().toMillis();
        try {
            return running.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new QueryTimeoutException("Waited " + timeoutMs + " ms for computation of " + flightKey, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EngineException(ErrorCodes.ENGINE_FAILURE, "Computation of " + flightKey + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTimeoutException("Interrupted while waiting for " + flightKey, e);
        }
    }

    private String render(CacheKey key) {
        return key.render(properties.getKeyPrefix());
    }

    private void count(String result) {
        Counter.builder("query.cache")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
