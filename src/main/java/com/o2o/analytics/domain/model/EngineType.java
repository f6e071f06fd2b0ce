package com.o2o.analytics.domain.model;

public enum EngineType {
    AGGREGATE_STORE,
    COLUMNAR_SNAPSHOT
}
