package com.o2o.analytics.domain.model;

import lombok.Data;

import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of rebuilding every segment of a definition inside a window.
 */
@Data
public class WindowRebuildResult {

    private final String definitionId;
    private final TimeWindow window;
    private int upserted;
    private int deleted;
    private int unchanged;
    private final Map<SegmentKey, String> failures = new TreeMap<>();

    public boolean changedAnything() {
        return upserted > 0 || deleted > 0;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public void recordUpserted() {
        upserted++;
    }

    public void recordDeleted() {
        deleted++;
    }

    public void recordUnchanged() {
        unchanged++;
    }
}
