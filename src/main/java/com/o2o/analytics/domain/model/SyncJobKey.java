package com.o2o.analytics.domain.model;

import lombok.Value;

/**
 * Jobs sharing a key never run concurrently and run in submission order.
 */
@Value
public class SyncJobKey {

    public static final String COLUMNAR_TARGET = "columnar-snapshot";

    String target;
    TimeWindow window;

    public static SyncJobKey definition(String definitionId, TimeWindow window) {
        return new SyncJobKey(definitionId, window);
    }

    /**
     * Key over the definition's bucket-aligned window, so jobs that rebuild the
     * same buckets share a key.
     */
    public static SyncJobKey definition(AggregationDefinition definition, TimeWindow window) {
        return new SyncJobKey(definition.getId(), definition.getBucket().align(window));
    }

    public static SyncJobKey columnar(TimeWindow window) {
        return new SyncJobKey(COLUMNAR_TARGET, window);
    }

    public boolean isColumnar() {
        return COLUMNAR_TARGET.equals(target);
    }

    @Override
    public String toString() {
        return target + "@" + window;
    }
}
