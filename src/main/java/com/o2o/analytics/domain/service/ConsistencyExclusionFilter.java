package com.o2o.analytics.domain.service;

import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.SegmentKey;

import java.util.Map;

/**
 * Business rule that takes a segment key out of the consistency check.
 * Every bean of this type is consulted; a key is skipped when any of them excludes it.
 */
@FunctionalInterface
public interface ConsistencyExclusionFilter {

    boolean excludes(AggregationDefinition definition, SegmentKey key, Map<String, String> dimensionValues);
}
