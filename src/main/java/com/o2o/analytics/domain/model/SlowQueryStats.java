package com.o2o.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class SlowQueryStats {

    long thresholdMs;
    long totalQueries;
    long slowQueries;

    /**
     * Slow queries that also crossed the warning threshold.
     */
    long verySlowQueries;

    Map<String, Long> slowByDefinition;

    /**
     * Newest first.
     */
    List<SlowQueryRecord> recent;
}
