package com.o2o.analytics.domain.model;

import com.o2o.analytics.config.EngineProperties;

/**
 * Data volume tiers. Small and medium volumes are served from precomputed
 * segments; large and huge volumes from the columnar snapshot.
 */
public enum DataTier {

    SMALL(EngineType.AGGREGATE_STORE),
    MEDIUM(EngineType.AGGREGATE_STORE),
    LARGE(EngineType.COLUMNAR_SNAPSHOT),
    HUGE(EngineType.COLUMNAR_SNAPSHOT);

    private final EngineType recommendedEngine;

    DataTier(EngineType recommendedEngine) {
        this.recommendedEngine = recommendedEngine;
    }

    public EngineType getRecommendedEngine() {
        return recommendedEngine;
    }

    public static DataTier of(long recordCount, EngineProperties.RouterProperties thresholds) {
        if (recordCount >= thresholds.getHugeThreshold()) {
            return HUGE;
        }
        if (recordCount >= thresholds.getLargeThreshold()) {
            return LARGE;
        }
        if (recordCount >= thresholds.getMediumThreshold()) {
            return MEDIUM;
        }
        return SMALL;
    }
}
