package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.SlowQueryRecord;
import com.o2o.analytics.domain.model.SlowQueryStats;
import com.o2o.analytics.domain.model.TimeWindow;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the most recent slow queries and per-definition slow counts.
 *
 * A query is slow when its end-to-end latency, cache lookup included, reaches
 * {@code o2o.engine.slow-query.threshold}. Slow queries past the warning
 * threshold are logged at WARN.
 */
@Slf4j
@Component
public class SlowQueryTracker {

    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong totalQueries = new AtomicLong();
    private final AtomicLong slowQueries = new AtomicLong();
    private final AtomicLong verySlowQueries = new AtomicLong();
    private final Map<String, AtomicLong> slowByDefinition = new ConcurrentHashMap<>();
    private final Deque<SlowQueryRecord> recent = new ConcurrentLinkedDeque<>();

    public SlowQueryTracker(EngineProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * @return true when the query was recorded as slow
     */
    public boolean record(String definitionId, EngineType engine, TimeWindow window,
                          Map<String, String> filters, long latencyMs, boolean cached) {
        totalQueries.incrementAndGet();
        EngineProperties.SlowQueryProperties config = properties.getSlowQuery();
        if (latencyMs < config.getThreshold().toMillis()) {
            return false;
        }

        slowQueries.incrementAndGet();
        slowByDefinition.computeIfAbsent(definitionId, k -> new AtomicLong()).incrementAndGet();
        Counter.builder("engine.query.slow")
                .tag("definition", definitionId)
                .tag("engine", String.valueOf(engine))
                .register(meterRegistry)
                .increment();

        recent.addFirst(SlowQueryRecord.builder()
                .definitionId(definitionId)
                .engine(engine)
                .window(window)
                .filters(new TreeMap<>(filters))
                .latencyMs(latencyMs)
                .cached(cached)
                .recordedAt(clock.instant())
                .build());
        while (recent.size() > config.getMaxRecords()) {
            recent.pollLast();
        }

        if (latencyMs >= config.getWarnThreshold().toMillis()) {
            verySlowQueries.incrementAndGet();
            log.warn("Slow query on {} over {} answered by {} in {} ms, filters {}",
                    definitionId, window, engine, latencyMs, filters);
        } else {
            log.debug("Slow query on {} over {}: {} ms", definitionId, window, latencyMs);
        }
        return true;
    }

    public SlowQueryStats snapshot() {
        Map<String, Long> byDefinition = new TreeMap<>();
        slowByDefinition.forEach((id, count) -> byDefinition.put(id, count.get()));
        return SlowQueryStats.builder()
                .thresholdMs(properties.getSlowQuery().getThreshold().toMillis())
                .totalQueries(totalQueries.get())
                .slowQueries(slowQueries.get())
                .verySlowQueries(verySlowQueries.get())
                .slowByDefinition(byDefinition)
                .recent(new ArrayList<>(recent))
                .build();
    }
}
