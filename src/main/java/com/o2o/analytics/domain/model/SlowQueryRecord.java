package com.o2o.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One query that took longer than the slow query threshold.
 */
@Value
@Builder
public class SlowQueryRecord {

    String definitionId;
    EngineType engine;
    TimeWindow window;
    Map<String, String> filters;
    long latencyMs;
    boolean cached;
    Instant recordedAt;
}
