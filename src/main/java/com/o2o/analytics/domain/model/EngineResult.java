package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached value of a query: the rows and the engine that produced them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineResult {

    private ResultSet resultSet;
    private EngineType engine;
    private long dataVersion;
    private long engineLatencyMs;
}
