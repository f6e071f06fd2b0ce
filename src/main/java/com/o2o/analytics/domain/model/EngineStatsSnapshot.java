package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStatsSnapshot {

    @Builder.Default
    private Map<EngineType, EngineCounters> engines = new EnumMap<>(EngineType.class);

    private long autoSwitches;
    private long fallbacks;
    private long timeouts;
    private long rejections;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EngineCounters {
        private long queries;
        private double avgLatencyMs;
    }
}
