package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.engine.QueryEngine;
import com.o2o.analytics.domain.exception.EngineException;
import com.o2o.analytics.domain.exception.EngineUnavailableException;
import com.o2o.analytics.domain.exception.ErrorCodes;
import com.o2o.analytics.domain.exception.QueryTimeoutException;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.DataTier;
import com.o2o.analytics.domain.model.EngineHealth;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.ResultSet;
import com.o2o.analytics.domain.model.RoutedResult;
import com.o2o.analytics.domain.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Chooses the engine for each query.
 *
 * Routing Rules:
 * 1. A forced engine (operator override) wins
 * 2. Otherwise the data tier recommends an engine: SMALL/MEDIUM the aggregate
 *    store, LARGE/HUGE the columnar snapshot
 * 3. The columnar snapshot is only used when it covers the window and is not degraded
 *
 * Failure Handling:
 * - Every engine call runs on the query executor with a deadline
 * - Query executor saturated: the call is rejected as unavailable, never run on the caller
 * - Deadline exceeded: engine degraded for the cool-down, QueryTimeoutException raised
 * - Columnar snapshot unavailable: query served by the aggregate store
 * - Columnar snapshot failure: logged, engine degraded, query served by the aggregate store
 */
@Slf4j
@Component
public class QueryRouter {

    private final Map<EngineType, QueryEngine> engines = new EnumMap<>(EngineType.class);
    private final EngineStats stats;
    private final EngineProperties.RouterProperties properties;
    private final Executor queryExecutor;
    private final Clock clock;

    private final AtomicLong recordCount = new AtomicLong();
    private final AtomicReference<EngineType> forcedEngine = new AtomicReference<>();
    private final Map<EngineType, Instant> degradedUntil = new ConcurrentHashMap<>();
    private final Map<String, EngineType> lastEngine = new ConcurrentHashMap<>();

    public QueryRouter(List<QueryEngine> queryEngines,
                       EngineStats stats,
                       EngineProperties engineProperties,
                       @Qualifier("queryExecutor") Executor queryExecutor,
                       Clock clock) {
        for (QueryEngine engine : queryEngines) {
            engines.put(engine.type(), engine);
        }
        if (!engines.containsKey(EngineType.AGGREGATE_STORE)) {
            throw new IllegalStateException("An aggregate store engine is required");
        }
        this.stats = stats;
        this.properties = engineProperties.getRouter();
        this.queryExecutor = queryExecutor;
        this.clock = clock;
    }

    public RoutedResult route(AggregationDefinition definition, Map<String, String> filters, TimeWindow window) {
        EngineType selected = select(window);

        if (selected == EngineType.COLUMNAR_SNAPSHOT) {
            try {
                return execute(engines.get(EngineType.COLUMNAR_SNAPSHOT), definition, filters, window);
            } catch (QueryTimeoutException e) {
                throw e;
            } catch (EngineUnavailableException e) {
                log.info("Columnar snapshot cannot serve {} over {}: {}", definition.getId(), window, e.getMessage());
                stats.recordFallback();
            } catch (RuntimeException e) {
                log.warn("Columnar query failed for {} over {}, falling back to aggregate store: {}",
                        definition.getId(), window, e.getMessage(), e);
                markDegraded(EngineType.COLUMNAR_SNAPSHOT);
                stats.recordFallback();
            }
        }
        return execute(engines.get(EngineType.AGGREGATE_STORE), definition, filters, window);
    }

    /**
     * Engine a query over {@code window} would be sent to.
     */
    public EngineType select(TimeWindow window) {
        EngineType forced = forcedEngine.get();
        if (forced != null && engines.containsKey(forced)) {
            return forced;
        }
        if (currentTier().getRecommendedEngine() == EngineType.COLUMNAR_SNAPSHOT
                && healthy(EngineType.COLUMNAR_SNAPSHOT, window)) {
            return EngineType.COLUMNAR_SNAPSHOT;
        }
        return EngineType.AGGREGATE_STORE;
    }

    /**
     * Tier recommendation adjusted for columnar availability and degradation.
     */
    public EngineType recommendedEngine() {
        if (currentTier().getRecommendedEngine() == EngineType.COLUMNAR_SNAPSHOT
                && healthy(EngineType.COLUMNAR_SNAPSHOT, null)) {
            return EngineType.COLUMNAR_SNAPSHOT;
        }
        return EngineType.AGGREGATE_STORE;
    }

    public DataTier currentTier() {
        return DataTier.of(recordCount.get(), properties);
    }

    public long recordCount() {
        return recordCount.get();
    }

    public void updateRecordCount(long count) {
        long previous = recordCount.getAndSet(count);
        DataTier before = DataTier.of(previous, properties);
        DataTier after = DataTier.of(count, properties);
        if (before != after) {
            log.info("Data tier changed {} -> {} at {} records (recommended engine {})",
                    before, after, count, after.getRecommendedEngine());
        }
    }

    public long switchThreshold() {
        return properties.getLargeThreshold();
    }

    public long recordsUntilSwitch() {
        return Math.max(0L, properties.getLargeThreshold() - recordCount.get());
    }

    public void forceEngine(EngineType engine) {
        if (!engines.containsKey(engine)) {
            throw new IllegalArgumentException("No engine of type " + engine);
        }
        EngineType previous = forcedEngine.getAndSet(engine);
        log.info("Engine override set to {} (was {})", engine, previous);
    }

    public void resetEngineOverride() {
        EngineType previous = forcedEngine.getAndSet(null);
        if (previous != null) {
            log.info("Engine override {} cleared", previous);
        }
    }

    public Optional<EngineType> forcedEngine() {
        return Optional.ofNullable(forcedEngine.get());
    }

    public Map<EngineType, EngineHealth> engineHealth() {
        Map<EngineType, EngineHealth> health = new EnumMap<>(EngineType.class);
        for (QueryEngine engine : engines.values()) {
            boolean degraded = isDegraded(engine.type());
            health.put(engine.type(), EngineHealth.builder()
                    .engine(engine.type())
                    .available(engine.available())
                    .degraded(degraded)
                    .degradedUntil(degraded ? degradedUntil.get(engine.type()) : null)
                    .detail(engine.available() ? "ready" : "not ready")
                    .build());
        }
        return health;
    }

    public boolean isDegraded(EngineType type) {
        Instant until = degradedUntil.get(type);
        if (until == null) {
            return false;
        }
        if (clock.instant().isBefore(until)) {
            return true;
        }
        if (degradedUntil.remove(type, until)) {
            log.info("{} cool-down over, engine eligible again", type);
        }
        return false;
    }

    void markDegraded(EngineType type) {
        Instant until = clock.instant().plus(properties.getDegradedCooldown());
        degradedUntil.put(type, until);
        log.warn("{} degraded until {}", type, until);
    }

    private boolean healthy(EngineType type, TimeWindow window) {
        QueryEngine engine = engines.get(type);
        if (engine == null || isDegraded(type)) {
            return false;
        }
        return window == null ? engine.available() : engine.available(window);
    }

    private RoutedResult execute(QueryEngine engine, AggregationDefinition definition,
                                 Map<String, String> filters, TimeWindow window) {
        long timeoutMs = properties.getQueryTimeout().toMillis();
        long start = System.nanoTime();
        FutureTask<ResultSet> future = new FutureTask<>(() -> engine.query(definition, filters, window));
        try {
            queryExecutor.execute(future);
        } catch (RejectedExecutionException e) {
            stats.recordRejected(engine.type());
            throw new EngineUnavailableException(engine.type(),
                    "Query pool saturated, " + engine.type() + " call for " + definition.getId() + " rejected");
        }

        ResultSet resultSet;
        try {
            resultSet = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // interrupts the engine call still running on the pool
            future.cancel(true);
            markDegraded(engine.type());
            stats.recordTimeout(engine.type());
            throw new QueryTimeoutException(engine.type() + " exceeded " + timeoutMs + " ms for "
                    + definition.getId() + " over " + window, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EngineException(ErrorCodes.ENGINE_FAILURE, engine.type() + " query failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTimeoutException("Interrupted while querying " + engine.type(), e);
        }

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        recordDecision(definition.getId(), engine.type(), latencyMs);
        return new RoutedResult(resultSet, engine.type(), latencyMs);
    }

    private void recordDecision(String definitionId, EngineType engine, long latencyMs) {
        stats.recordQuery(engine, latencyMs);
        EngineType previous = lastEngine.put(definitionId, engine);
        if (previous != null && previous != engine) {
            stats.recordAutoSwitch(previous, engine);
            log.info("Engine switch for {}: {} -> {} (tier {}, {} records)",
                    definitionId, previous, engine, currentTier(), recordCount.get());
        }
    }
}
