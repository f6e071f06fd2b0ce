package com.o2o.analytics.domain.service;

import com.o2o.analytics.domain.model.EngineStatsSnapshot;
import com.o2o.analytics.domain.model.EngineType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime routing counters, mirrored to Micrometer.
 */
@Component
public class EngineStats {

    private final MeterRegistry meterRegistry;
    private final Map<EngineType, AtomicLong> queries = new EnumMap<>(EngineType.class);
    private final Map<EngineType, AtomicLong> totalLatencyMs = new EnumMap<>(EngineType.class);
    private final AtomicLong autoSwitches = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();

    public EngineStats(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (EngineType type : EngineType.values()) {
            queries.put(type, new AtomicLong());
            totalLatencyMs.put(type, new AtomicLong());
        }
    }

    public void recordQuery(EngineType engine, long latencyMs) {
        queries.get(engine).incrementAndGet();
        totalLatencyMs.get(engine).addAndGet(latencyMs);
        Timer.builder("engine.query.latency")
                .tag("engine", engine.name())
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void recordAutoSwitch(EngineType from, EngineType to) {
        autoSwitches.incrementAndGet();
        Counter.builder("engine.auto.switch")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordFallback() {
        fallbacks.incrementAndGet();
        Counter.builder("engine.fallback").register(meterRegistry).increment();
    }

    public void recordTimeout(EngineType engine) {
        timeouts.incrementAndGet();
        Counter.builder("engine.timeout")
                .tag("engine", engine.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordRejected(EngineType engine) {
        rejections.incrementAndGet();
        Counter.builder("engine.query.rejected")
                .tag("engine", engine.name())
                .register(meterRegistry)
                .increment();
    }

    public EngineStatsSnapshot snapshot() {
        Map<EngineType, EngineStatsSnapshot.EngineCounters> engines = new EnumMap<>(EngineType.class);
        for (EngineType type : EngineType.values()) {
            long count = queries.get(type).get();
            double avg = count == 0 ? 0.0 : (double) totalLatencyMs.get(type).get() / count;
            engines.put(type, new EngineStatsSnapshot.EngineCounters(count, avg));
        }
        return EngineStatsSnapshot.builder()
                .engines(engines)
                .autoSwitches(autoSwitches.get())
                .fallbacks(fallbacks.get())
                .timeouts(timeouts.get())
                .rejections(rejections.get())
                .build();
    }
}
