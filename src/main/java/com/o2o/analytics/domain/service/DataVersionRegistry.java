package com.o2o.analytics.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Current data version per definition. Cached results carry the version they
 * were computed at and stop matching once it moves.
 *
 * Versions start at the process start time (epoch millis) and only grow, so an
 * entry written by an earlier process into a shared cache never matches.
 */
@Slf4j
@Component
public class DataVersionRegistry {

    private final Clock clock;
    private final long baseline;
    private final Map<String, AtomicLong> versions = new ConcurrentHashMap<>();

    public DataVersionRegistry(Clock clock) {
        this.clock = clock;
        this.baseline = clock.millis();
    }

    public long current(String definitionId) {
        return counter(definitionId).get();
    }

    /**
     * Moves the version forward and returns the new value.
     */
    public long bump(String definitionId) {
        long now = clock.millis();
        long next = counter(definitionId).updateAndGet(v -> Math.max(v + 1, now));
        log.debug("Data version of {} is now {}", definitionId, next);
        return next;
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        versions.forEach((id, v) -> snapshot.put(id, v.get()));
        return snapshot;
    }

    private AtomicLong counter(String definitionId) {
        return versions.computeIfAbsent(definitionId, id -> new AtomicLong(baseline));
    }
}
