package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.engine.ColumnarSnapshotEngine;
import com.o2o.analytics.domain.exception.InvalidQueryException;
import com.o2o.analytics.domain.model.AggregateSegment;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.ConsistencyReport;
import com.o2o.analytics.domain.model.EngineHealth;
import com.o2o.analytics.domain.model.EngineQueryRequest;
import com.o2o.analytics.domain.model.EngineQueryResponse;
import com.o2o.analytics.domain.model.EngineResult;
import com.o2o.analytics.domain.model.EngineStatus;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.RepairResult;
import com.o2o.analytics.domain.model.RoutedResult;
import com.o2o.analytics.domain.model.SyncJobKey;
import com.o2o.analytics.domain.model.SyncMode;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.infrastructure.cache.CacheKey;
import com.o2o.analytics.infrastructure.cache.VersionedQueryCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for analytics queries and engine operations.
 *
 * Query Flow:
 * 1. Resolve the definition and validate filters and window
 * 2. Align the window to the definition's buckets
 * 3. Look up (key, current data version) in the versioned cache
 * 4. On a miss, route to an engine; concurrent identical queries share one computation
 * 5. Return rows with the engine used, the data version and whether the cache answered
 *
 * Freshness:
 * - Every change to segments bumps the definition's data version, so a cached
 *   result never outlives the data it was computed from
 * - TTLs only bound memory; empty results get the short empty TTL
 */
@Slf4j
@Service
public class EngineQueryService {

    private final DefinitionRegistry definitionRegistry;
    private final QueryRouter router;
    private final VersionedQueryCache cache;
    private final DataVersionRegistry versionRegistry;
    private final AggregateSegmentService segmentService;
    private final ConsistencyService consistencyService;
    private final SyncScheduler syncScheduler;
    private final ColumnarSnapshotEngine columnarEngine;
    private final EngineStats engineStats;
    private final SlowQueryTracker slowQueryTracker;
    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public EngineQueryService(DefinitionRegistry definitionRegistry,
                              QueryRouter router,
                              VersionedQueryCache cache,
                              DataVersionRegistry versionRegistry,
                              AggregateSegmentService segmentService,
                              ConsistencyService consistencyService,
                              SyncScheduler syncScheduler,
                              ColumnarSnapshotEngine columnarEngine,
                              EngineStats engineStats,
                              SlowQueryTracker slowQueryTracker,
                              EngineProperties properties,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.definitionRegistry = definitionRegistry;
        this.router = router;
        this.cache = cache;
        this.versionRegistry = versionRegistry;
        this.segmentService = segmentService;
        this.consistencyService = consistencyService;
        this.syncScheduler = syncScheduler;
        this.columnarEngine = columnarEngine;
        this.engineStats = engineStats;
        this.slowQueryTracker = slowQueryTracker;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public EngineQueryResponse query(EngineQueryRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.nanoTime();

        AggregationDefinition definition = definitionRegistry.require(request.getDefinitionId());
        Map<String, String> filters = request.getFilters();
        validateFilters(definition, filters);
        TimeWindow window = definition.getBucket().align(windowOf(request));

        long version = versionRegistry.current(definition.getId());
        CacheKey key = CacheKey.of(definition.getId(), filters, window);
        AtomicBoolean computed = new AtomicBoolean();

        EngineResult result = cache.getOrCompute(key, version, properties.getCache().getTtl(), EngineResult.class,
                () -> {
                    computed.set(true);
                    RoutedResult routed = router.route(definition, filters, window);
                    return EngineResult.builder()
                            .resultSet(routed.getResultSet())
                            .engine(routed.getEngine())
                            .dataVersion(version)
                            .engineLatencyMs(routed.getLatencyMs())
                            .build();
                },
                r -> r.getResultSet() == null || r.getResultSet().isEmpty());

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        sample.stop(Timer.builder("engine.request")
                .tag("definition", definition.getId())
                .tag("cached", String.valueOf(!computed.get()))
                .register(meterRegistry));

        log.debug("{} over {} answered by {} in {} ms (cached: {})",
                definition.getId(), window, result.getEngine(), latencyMs, !computed.get());
        slowQueryTracker.record(definition.getId(), result.getEngine(), window, filters, latencyMs, !computed.get());

        return EngineQueryResponse.builder()
                .resultSet(result.getResultSet())
                .engineUsed(result.getEngine())
                .latencyMs(latencyMs)
                .dataVersion(result.getDataVersion())
                .cached(!computed.get())
                .build();
    }

    public EngineStatus status() {
        return EngineStatus.builder()
                .currentTier(router.currentTier())
                .recordCount(router.recordCount())
                .recommendedEngine(router.recommendedEngine())
                .forcedEngine(router.forcedEngine().orElse(null))
                .engineHealth(router.engineHealth())
                .stats(engineStats.snapshot())
                .slowQueries(slowQueryTracker.snapshot())
                .cache(cache.stats())
                .dataVersions(versionRegistry.snapshot())
                .unresolvedKeys(consistencyService.unresolved())
                .failedJobs(syncScheduler.failedJobs())
                .recentJobs(syncScheduler.recentJobs())
                .switchThreshold(router.switchThreshold())
                .recordsUntilSwitch(router.recordsUntilSwitch())
                .columnarGeneration(columnarEngine.generation())
                .lastConsistencyCheck(consistencyService.lastCheck().orElse(null))
                .build();
    }

    public Map<EngineType, EngineHealth> engineHealth() {
        return router.engineHealth();
    }

    public void forceEngine(EngineType engine) {
        router.forceEngine(engine);
    }

    public void resetEngineOverride() {
        router.resetEngineOverride();
    }

    /**
     * Drops cached results of a definition. With a dimension key, every published
     * segment of that key is recomputed first.
     *
     * @return the new data version of the definition
     */
    public long invalidate(String definitionId, String dimensionKey) {
        AggregationDefinition definition = definitionRegistry.require(definitionId);
        if (dimensionKey != null && !dimensionKey.isBlank()) {
            List<AggregateSegment> segments = segmentService.getSegments(definition, dimensionKey);
            for (AggregateSegment segment : segments) {
                segmentService.upsertSegment(definition, segment.key());
            }
            log.info("Rebuilt {} segments of {} for key {}", segments.size(), definitionId, dimensionKey);
        }
        long version = versionRegistry.bump(definitionId);
        cache.invalidateDefinition(definitionId);
        return version;
    }

    public ConsistencyReport checkConsistency(String definitionId, LocalDate start, LocalDate end) {
        AggregationDefinition definition = definitionRegistry.require(definitionId);
        return consistencyService.check(definition, windowOrLookback(start, end));
    }

    public RepairResult repairConsistency(String definitionId, LocalDate start, LocalDate end) {
        AggregationDefinition definition = definitionRegistry.require(definitionId);
        return consistencyService.checkAndRepair(definition, windowOrLookback(start, end));
    }

    /**
     * Queues a rebuild of the definition over the window.
     */
    public SyncJobKey triggerSync(String definitionId, LocalDate start, LocalDate end, SyncMode mode) {
        AggregationDefinition definition = definitionRegistry.require(definitionId);
        SyncJobKey key = SyncJobKey.definition(definition, windowOrLookback(start, end));
        syncScheduler.submit(key, mode);
        return key;
    }

    private TimeWindow windowOf(EngineQueryRequest request) {
        try {
            return request.toWindow(LocalDate.now(clock));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(e.getMessage(), e);
        }
    }

    private TimeWindow windowOrLookback(LocalDate start, LocalDate end) {
        if (start == null && end == null) {
            return syncScheduler.lookbackWindow();
        }
        LocalDate effectiveEnd = end != null ? end : LocalDate.now(clock);
        LocalDate effectiveStart = start != null ? start : effectiveEnd;
        try {
            return TimeWindow.of(effectiveStart, effectiveEnd);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(e.getMessage(), e);
        }
    }

    private static void validateFilters(AggregationDefinition definition, Map<String, String> filters) {
        for (String field : filters.keySet()) {
            if (!definition.getGroupBy().contains(field)) {
                throw new InvalidQueryException("Filter '" + field + "' is not a group-by field of "
                        + definition.getId() + " " + definition.getGroupBy());
            }
        }
    }
}
