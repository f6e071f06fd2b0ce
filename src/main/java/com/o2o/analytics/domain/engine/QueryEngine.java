package com.o2o.analytics.domain.engine;

import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.ResultSet;
import com.o2o.analytics.domain.model.TimeWindow;

import java.util.Map;

/**
 * Execution path for definition queries. The router only talks to this interface.
 */
public interface QueryEngine {

    EngineType type();

    /**
     * Aggregates {@code definition} over a bucket-aligned window.
     *
     * @param filters equality filters on group-by keys of the definition, already validated
     */
    ResultSet query(AggregationDefinition definition, Map<String, String> filters, TimeWindow window);

    boolean available();

    /**
     * Whether the engine can answer for this window specifically.
     */
    default boolean available(TimeWindow window) {
        return available();
    }
}
