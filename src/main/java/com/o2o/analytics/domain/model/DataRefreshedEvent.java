package com.o2o.analytics.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Segments or the columnar snapshot changed for these definitions.
 */
@Value
public class DataRefreshedEvent {

    List<String> definitionIds;
    TimeWindow window;
}
