package com.o2o.analytics.infrastructure.cache;

import java.util.Optional;

/**
 * Storage behind {@link VersionedQueryCache}.
 */
public interface CacheStore {

    /**
     * @return the entry, or empty when absent, expired, or not of {@code type}
     */
    <T> Optional<CacheEntry<T>> get(String key, Class<T> type);

    /**
     * Stores an entry unless the key already holds a newer data version.
     */
    void put(String key, CacheEntry<?> entry);

    void evict(String key);

    /**
     * @return number of entries removed
     */
    long evictByPrefix(String prefix);

    long size();
}
