package com.o2o.analytics.infrastructure.persistence.entity;

import com.o2o.analytics.domain.model.AggregateSegment;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Stored aggregate segment.
 *
 * A rebuild inserts a SHADOW row and, in the same transaction, deletes the
 * PUBLISHED row it replaces and promotes the shadow. Readers only select
 * PUBLISHED rows, so they see either the old or the new segment.
 */
@Entity
@Table(name = "aggregate_segments", indexes = {
    @Index(name = "idx_segment_lookup", columnList = "definitionId,dimensionKey,bucketStart,state"),
    @Index(name = "idx_segment_window", columnList = "definitionId,state,bucketStart")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateSegmentEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID segmentId;

    @Column(nullable = false, length = 100)
    private String definitionId;

    @Column(nullable = false, length = 255)
    private String dimensionKey;

    @Column(nullable = false)
    private LocalDate bucketStart;

    @Convert(converter = JsonMapConverters.StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> dimensionValues = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverters.DoubleMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Double> measureValues = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverters.DoubleMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Double> derivedValues = new LinkedHashMap<>();

    @Column(nullable = false)
    private long sourceRowCount;

    @Column(nullable = false)
    private long sourceVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SegmentState state = SegmentState.SHADOW;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant publishedAt;

    public enum SegmentState {
        SHADOW,
        PUBLISHED
    }

    @PrePersist
    protected void onCreate() {
        if (segmentId == null) {
            segmentId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markPublished(Instant at) {
        this.state = SegmentState.PUBLISHED;
        this.publishedAt = at;
    }

    public static AggregateSegmentEntity shadowOf(AggregateSegment segment) {
        return AggregateSegmentEntity.builder()
                .definitionId(segment.getDefinitionId())
                .dimensionKey(segment.getDimensionKey())
                .bucketStart(segment.getBucket())
                .dimensionValues(new LinkedHashMap<>(segment.getDimensionValues()))
                .measureValues(new LinkedHashMap<>(segment.getMeasures()))
                .derivedValues(new LinkedHashMap<>(segment.getDerived()))
                .sourceRowCount(segment.getSourceRowCount())
                .sourceVersion(segment.getVersion())
                .state(SegmentState.SHADOW)
                .build();
    }

    public AggregateSegment toSegment() {
        return AggregateSegment.builder()
                .definitionId(definitionId)
                .dimensionKey(dimensionKey)
                .bucket(bucketStart)
                .dimensionValues(new LinkedHashMap<>(dimensionValues))
                .measures(new LinkedHashMap<>(measureValues))
                .derived(new LinkedHashMap<>(derivedValues))
                .sourceRowCount(sourceRowCount)
                .version(sourceVersion)
                .publishedAt(publishedAt)
                .build();
    }
}
