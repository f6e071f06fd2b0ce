package com.o2o.analytics.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Identity of a segment inside a definition: group-by values plus bucket start.
 */
@Value
public class SegmentKey implements Comparable<SegmentKey> {

    public static final String KEY_SEPARATOR = "|";

    private static final Comparator<SegmentKey> ORDER = Comparator
            .comparing(SegmentKey::getBucket)
            .thenComparing(SegmentKey::getDimensionKey);

    String dimensionKey;
    LocalDate bucket;

    public static SegmentKey of(String dimensionKey, LocalDate bucket) {
        return new SegmentKey(dimensionKey, bucket);
    }

    @Override
    public int compareTo(SegmentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + dimensionKey + ", " + bucket + ")";
    }
}
