package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineQueryResponse {

    private ResultSet resultSet;
    private EngineType engineUsed;
    private long latencyMs;
    private long dataVersion;

    /**
     * True when no engine ran for this call.
     */
    private boolean cached;
}
