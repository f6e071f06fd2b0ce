package com.o2o.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis store shared across service instances.
 *
 * Entries are JSON envelopes {@code {value, empty, dataVersion, expiresAt}}
 * with a Redis TTL matching {@code expiresAt}.
 *
 * Failure Handling:
 * - Circuit breaker "redis" wraps every call
 * - While it is open, reads are misses and writes are skipped, so queries go to the engines
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    private static final int SCAN_BATCH = 500;

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisCacheStore(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper,
                           Clock clock, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public <T> Optional<CacheEntry<T>> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            return Optional.empty();
        }
        try {
            JsonNode envelope = objectMapper.readTree(cached);
            JsonNode valueNode = envelope.get("value");
            T value = valueNode == null || valueNode.isNull() ? null : objectMapper.treeToValue(valueNode, type);
            Instant expiresAt = envelope.hasNonNull("expiresAt")
                    ? objectMapper.convertValue(envelope.get("expiresAt"), Instant.class)
                    : null;
            return Optional.of(new CacheEntry<>(value,
                    envelope.path("empty").asBoolean(false),
                    envelope.path("dataVersion").asLong(),
                    expiresAt));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "putFallback")
    public void put(String key, CacheEntry<?> entry) {
        Duration ttl = entry.getExpiresAt() == null
                ? Duration.ZERO
                : Duration.between(clock.instant(), entry.getExpiresAt());
        if (entry.getExpiresAt() != null && (ttl.isNegative() || ttl.isZero())) {
            return;
        }
        String existing = redisTemplate.opsForValue().get(key);
        if (existing != null && storedVersion(existing) > entry.getDataVersion()) {
            log.debug("Keeping newer cache entry for {}", key);
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.error("Error serializing cache entry {}: {}", key, e.getMessage());
            return;
        }
        if (entry.getExpiresAt() == null) {
            redisTemplate.opsForValue().set(key, json);
        } else {
            redisTemplate.opsForValue().set(key, json, ttl.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.debug("Cached result for key: {} (TTL: {}ms)", key, ttl.toMillis());
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "evictFallback")
    public void evict(String key) {
        redisTemplate.delete(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    /**
     * Deletes every key under {@code prefix}, walking the keyspace with SCAN in batches.
     */
    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "evictByPrefixFallback")
    public long evictByPrefix(String prefix) {
        long deleted = 0L;
        List<String> batch = new ArrayList<>(SCAN_BATCH);
        try (Cursor<String> cursor = redisTemplate.scan(scanOptions(prefix))) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH) {
                    deleted += delete(batch);
                    batch = new ArrayList<>(SCAN_BATCH);
                }
            }
        }
        return deleted + delete(batch);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "sizeFallback")
    public long size() {
        long count = 0L;
        try (Cursor<String> cursor = redisTemplate.scan(scanOptions(keyPrefix))) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
        }
        return count;
    }

    private long delete(List<String> keys) {
        if (keys.isEmpty()) {
            return 0L;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted == null ? 0L : deleted;
    }

    private static ScanOptions scanOptions(String prefix) {
        return ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build();
    }

    private long storedVersion(String json) {
        try {
            return objectMapper.readTree(json).path("dataVersion").asLong();
        } catch (JsonProcessingException e) {
            return Long.MIN_VALUE;
        }
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<CacheEntry<T>> getFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable, treating {} as a miss: {}", key, e.getMessage());
        return Optional.empty();
    }

    private void putFallback(String key, CacheEntry<?> entry, Exception e) {
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, e.getMessage());
    }

    private void evictFallback(String key, Exception e) {
        log.warn("Redis unavailable, skipping cache invalidation for {}: {}", key, e.getMessage());
    }

    private long evictByPrefixFallback(String prefix, Exception e) {
        log.warn("Redis unavailable, skipping invalidation of {}*: {}", prefix, e.getMessage());
        return 0L;
    }

    private long sizeFallback(Exception e) {
        return -1L;
    }
}
