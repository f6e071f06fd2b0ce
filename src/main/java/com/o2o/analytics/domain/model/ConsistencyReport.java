package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of comparing raw records with published segments for one definition and window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyReport {

    private String definitionId;
    private TimeWindow window;

    /**
     * Keys with raw records but no published segment.
     */
    @Builder.Default
    private SortedSet<SegmentKey> missingKeys = new TreeSet<>();

    /**
     * Published segments whose key has no raw records at all.
     */
    @Builder.Default
    private SortedSet<SegmentKey> orphanKeys = new TreeSet<>();

    @Builder.Default
    private SortedSet<SegmentKey> mismatchedKeys = new TreeSet<>();

    @Builder.Default
    private Map<SegmentKey, KeyMismatch> mismatchDetails = new TreeMap<>();

    private int checkedKeys;
    private int excludedKeys;
    private Instant checkedAt;

    public boolean isConsistent() {
        return missingKeys.isEmpty() && orphanKeys.isEmpty() && mismatchedKeys.isEmpty();
    }

    public int driftCount() {
        return missingKeys.size() + orphanKeys.size() + mismatchedKeys.size();
    }
}
