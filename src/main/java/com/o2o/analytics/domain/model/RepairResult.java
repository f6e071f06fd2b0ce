package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepairResult {

    private String definitionId;
    private ConsistencyReport report;

    @Builder.Default
    private SortedSet<SegmentKey> repairedKeys = new TreeSet<>();

    @Builder.Default
    private SortedSet<SegmentKey> deletedKeys = new TreeSet<>();

    /**
     * Keys that could not be repaired, with the failure message.
     */
    @Builder.Default
    private Map<SegmentKey, String> unresolvedKeys = new TreeMap<>();

    public boolean changedAnything() {
        return !repairedKeys.isEmpty() || !deletedKeys.isEmpty();
    }
}
