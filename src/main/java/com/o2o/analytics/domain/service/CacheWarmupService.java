package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.DataRefreshedEvent;
import com.o2o.analytics.domain.model.EngineQueryRequest;
import com.o2o.analytics.domain.model.EngineQueryResponse;
import com.o2o.analytics.domain.model.WarmupResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Pre-computes the hot windows of each definition so the first reader after
 * startup or a sync is answered from the cache.
 *
 * Hot windows end today; their lengths come from {@code o2o.engine.warmup.window-days}.
 * Warming goes through the normal query path, so results land under the current
 * data version and a reader arriving mid-warm-up shares the computation.
 */
@Slf4j
@Service
public class CacheWarmupService {

    private final EngineQueryService engineQueryService;
    private final DefinitionRegistry definitionRegistry;
    private final EngineProperties properties;
    private final Executor syncExecutor;
    private final Clock clock;

    private final AtomicReference<WarmupResult> lastResult = new AtomicReference<>();

    public CacheWarmupService(EngineQueryService engineQueryService,
                              DefinitionRegistry definitionRegistry,
                              EngineProperties properties,
                              @Qualifier("syncExecutor") Executor syncExecutor,
                              Clock clock) {
        this.engineQueryService = engineQueryService;
        this.definitionRegistry = definitionRegistry;
        this.properties = properties;
        this.syncExecutor = syncExecutor;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getWarmup().isEnabled()) {
            warmUpAsync(allDefinitionIds());
        }
    }

    @EventListener
    public void onDataRefreshed(DataRefreshedEvent event) {
        if (properties.getWarmup().isEnabled()) {
            warmUpAsync(event.getDefinitionIds());
        }
    }

    public CompletableFuture<WarmupResult> warmUpAsync(Collection<String> definitionIds) {
        return CompletableFuture.supplyAsync(() -> warmUp(definitionIds), syncExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Cache warm-up failed: {}", error.getMessage(), error);
                    }
                });
    }

    public WarmupResult warmUpAll() {
        return warmUp(allDefinitionIds());
    }

    /**
     * Runs every hot window query of the given definitions. Unknown ids are skipped;
     * a failing query is recorded and the rest still run.
     */
    public WarmupResult warmUp(Collection<String> definitionIds) {
        long start = System.nanoTime();
        WarmupResult result = new WarmupResult(clock.instant());
        LocalDate today = LocalDate.now(clock);

        for (String definitionId : new TreeSet<>(definitionIds)) {
            if (definitionRegistry.find(definitionId).isEmpty()) {
                log.debug("Skipping warm-up of unknown definition {}", definitionId);
                continue;
            }
            for (int days : properties.getWarmup().getWindowDays()) {
                EngineQueryRequest request = EngineQueryRequest.builder()
                        .definitionId(definitionId)
                        .start(today.minusDays(days - 1L))
                        .end(today)
                        .build();
                try {
                    EngineQueryResponse response = engineQueryService.query(request);
                    if (response.isCached()) {
                        result.setAlreadyCached(result.getAlreadyCached() + 1);
                    } else {
                        result.setComputed(result.getComputed() + 1);
                    }
                } catch (RuntimeException e) {
                    log.warn("Warm-up of {} over the last {} days failed: {}", definitionId, days, e.getMessage());
                    result.getFailures().put(definitionId + "@" + days, e.getMessage());
                }
            }
        }

        result.setDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        lastResult.set(result);
        log.info("Cache warm-up: {} computed, {} already cached, {} failed ({} ms)",
                result.getComputed(), result.getAlreadyCached(), result.getFailed(), result.getDurationMs());
        return result;
    }

    public Optional<WarmupResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    private Collection<String> allDefinitionIds() {
        return definitionRegistry.all().stream()
                .map(AggregationDefinition::getId)
                .collect(Collectors.toList());
    }
}
