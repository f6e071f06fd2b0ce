package com.o2o.analytics.infrastructure.persistence.repository;

import com.o2o.analytics.infrastructure.persistence.entity.AggregateSegmentEntity;
import com.o2o.analytics.infrastructure.persistence.entity.AggregateSegmentEntity.SegmentState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface AggregateSegmentRepository extends JpaRepository<AggregateSegmentEntity, UUID> {

    /**
     * Published rows of one segment, newest version first. Normally zero or one row.
     */
    @Query("SELECT s FROM AggregateSegmentEntity s WHERE " +
           "s.definitionId = :definitionId AND s.dimensionKey = :dimensionKey AND " +
           "s.bucketStart = :bucket AND s.state = :state " +
           "ORDER BY s.sourceVersion DESC")
    List<AggregateSegmentEntity> findSegment(
            @Param("definitionId") String definitionId,
            @Param("dimensionKey") String dimensionKey,
            @Param("bucket") LocalDate bucket,
            @Param("state") SegmentState state
    );

    /**
     * Same as {@link #findSegment} but takes a write lock on the rows, serializing swaps of one segment.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AggregateSegmentEntity s WHERE " +
           "s.definitionId = :definitionId AND s.dimensionKey = :dimensionKey AND " +
           "s.bucketStart = :bucket AND s.state = :state " +
           "ORDER BY s.sourceVersion DESC")
    List<AggregateSegmentEntity> lockSegment(
            @Param("definitionId") String definitionId,
            @Param("dimensionKey") String dimensionKey,
            @Param("bucket") LocalDate bucket,
            @Param("state") SegmentState state
    );

    @Query("SELECT s FROM AggregateSegmentEntity s WHERE " +
           "s.definitionId = :definitionId AND s.state = :state AND " +
           "s.bucketStart BETWEEN :start AND :end " +
           "ORDER BY s.bucketStart ASC, s.dimensionKey ASC")
    List<AggregateSegmentEntity> findInWindow(
            @Param("definitionId") String definitionId,
            @Param("state") SegmentState state,
            @Param("start") LocalDate start,
            @Param("end") LocalDate end
    );

    @Query("SELECT s FROM AggregateSegmentEntity s WHERE " +
           "s.definitionId = :definitionId AND s.dimensionKey = :dimensionKey AND s.state = :state " +
           "ORDER BY s.bucketStart ASC")
    List<AggregateSegmentEntity> findByDimensionKey(
            @Param("definitionId") String definitionId,
            @Param("dimensionKey") String dimensionKey,
            @Param("state") SegmentState state
    );
}
