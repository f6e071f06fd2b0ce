package com.o2o.analytics.domain.model;

import lombok.Value;

@Value
public class RoutedResult {

    ResultSet resultSet;
    EngineType engine;
    long latencyMs;
}
