package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Published aggregate for one (definition, dimension key, bucket).
 *
 * {@code version} is the newest {@code updatedAt} (epoch millis) among the
 * records that fed it, tombstones included, so a deletion always advances it.
 * Two segments are equal when their content is equal; publish time is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateSegment {

    private String definitionId;
    private String dimensionKey;
    private LocalDate bucket;

    @Builder.Default
    private Map<String, String> dimensionValues = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> measures = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> derived = new LinkedHashMap<>();

    private long sourceRowCount;
    private long version;

    @EqualsAndHashCode.Exclude
    private Instant publishedAt;

    public SegmentKey key() {
        return SegmentKey.of(dimensionKey, bucket);
    }

    /**
     * Equal aggregates regardless of version and publish time.
     */
    public boolean sameContentAs(AggregateSegment other) {
        return other != null
                && sourceRowCount == other.sourceRowCount
                && Objects.equals(dimensionValues, other.dimensionValues)
                && Objects.equals(measures, other.measures)
                && Objects.equals(derived, other.derived);
    }

    public ResultRow toRow() {
        return ResultRow.builder()
                .dimensions(new LinkedHashMap<>(dimensionValues))
                .bucket(bucket)
                .measures(new LinkedHashMap<>(measures))
                .derived(new LinkedHashMap<>(derived))
                .sourceRowCount(sourceRowCount)
                .build();
    }
}
