package com.o2o.analytics.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hits;
    private long misses;

    /**
     * Misses caused by an entry computed at an older data version.
     */
    private long staleVersionMisses;

    /**
     * Hits on cached empty results, i.e. requests that would have gone to an engine for nothing.
     */
    private long emptyHits;

    private long computes;
    private long singleFlightWaits;
    private long size;

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
