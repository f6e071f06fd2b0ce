package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineHealth {

    private EngineType engine;
    private boolean available;
    private boolean degraded;
    private Instant degradedUntil;
    private String detail;
}
