package com.o2o.analytics.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cached value tagged with the data version it was computed at.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry<T> {

    private T value;

    /**
     * Result had no rows; stored with the short empty TTL.
     */
    private boolean empty;

    private long dataVersion;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
