package com.o2o.analytics.domain.model;

import com.o2o.analytics.infrastructure.cache.CacheStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operational view of the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStatus {

    private DataTier currentTier;
    private long recordCount;
    private EngineType recommendedEngine;
    private EngineType forcedEngine;
    private Map<EngineType, EngineHealth> engineHealth;
    private EngineStatsSnapshot stats;
    private SlowQueryStats slowQueries;
    private CacheStats cache;
    private Map<String, Long> dataVersions;
    private Map<String, List<UnresolvedKey>> unresolvedKeys;
    private List<SyncJob> failedJobs;
    private List<SyncJob> recentJobs;

    /**
     * Record count at which queries move to the columnar snapshot.
     */
    private long switchThreshold;
    private long recordsUntilSwitch;
    private long columnarGeneration;
    private Instant lastConsistencyCheck;
}
