package com.o2o.analytics.domain.model;

import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one cache warm-up run.
 */
@Data
public class WarmupResult {

    private final Instant startedAt;
    private int computed;
    private int alreadyCached;
    private long durationMs;

    /**
     * "definition@days" to error message.
     */
    private final Map<String, String> failures = new LinkedHashMap<>();

    public int getFailed() {
        return failures.size();
    }
}
