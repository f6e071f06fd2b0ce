package com.o2o.analytics.domain.model;

import lombok.Value;

/**
 * A definition was added or replaced at runtime.
 */
@Value
public class DefinitionRegisteredEvent {

    AggregationDefinition definition;
    boolean replaced;
}
