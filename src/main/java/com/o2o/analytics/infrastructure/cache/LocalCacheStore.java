package com.o2o.analytics.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-process Caffeine store.
 *
 * - Per-entry expiry taken from {@link CacheEntry#getExpiresAt()}
 * - maximumSize bounds memory independently of TTL (W-TinyLFU eviction)
 * - Expiry is re-checked on read against the injected clock
 */
@Slf4j
public class LocalCacheStore implements CacheStore {

    private final Cache<String, CacheEntry<?>> cache;
    private final Clock clock;

    public LocalCacheStore(long maxEntries, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    @Override
    public <T> Optional<CacheEntry<T>> get(String key, Class<T> type) {
        CacheEntry<?> entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.asMap().remove(key, entry);
            return Optional.empty();
        }
        Object value = entry.getValue();
        if (value != null && !type.isInstance(value)) {
            log.warn("Cache entry {} holds {}, expected {}", key, value.getClass().getName(), type.getName());
            return Optional.empty();
        }
        return Optional.of(new CacheEntry<>(type.cast(value), entry.isEmpty(), entry.getDataVersion(), entry.getExpiresAt()));
    }

    @Override
    public void put(String key, CacheEntry<?> entry) {
        cache.asMap().merge(key, entry,
                (existing, incoming) -> incoming.getDataVersion() >= existing.getDataVersion() ? incoming : existing);
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    @Override
    public long evictByPrefix(String prefix) {
        List<String> keys = cache.asMap().keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .collect(Collectors.toList());
        cache.invalidateAll(keys);
        return keys.size();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private final class EntryExpiry implements Expiry<String, CacheEntry<?>> {

        @Override
        public long expireAfterCreate(String key, CacheEntry<?> value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<?> value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<?> value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry<?> value) {
            if (value.getExpiresAt() == null) {
                return Long.MAX_VALUE;
            }
            Instant now = clock.instant();
            return Math.max(0L, Duration.between(now, value.getExpiresAt()).toNanos());
        }
    }
}
