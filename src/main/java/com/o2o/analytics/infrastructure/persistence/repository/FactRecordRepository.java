package com.o2o.analytics.infrastructure.persistence.repository;

import com.o2o.analytics.infrastructure.persistence.entity.FactRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Raw fact table access.
 *
 * Window scans include tombstones unless the method says otherwise; segment
 * versions and consistency keys depend on seeing deleted rows.
 */
@Repository
public interface FactRecordRepository extends JpaRepository<FactRecordEntity, UUID> {

    @Query("SELECT f FROM FactRecordEntity f WHERE " +
           "f.orderDate BETWEEN :start AND :end " +
           "ORDER BY f.orderDate ASC, f.orderId ASC")
    List<FactRecordEntity> findInWindow(
            @Param("start") LocalDate start,
            @Param("end") LocalDate end
    );

    /**
     * Live rows only; used for the columnar export.
     */
    @Query("SELECT f FROM FactRecordEntity f WHERE " +
           "f.deleted = false AND f.orderDate BETWEEN :start AND :end " +
           "ORDER BY f.orderDate ASC, f.orderId ASC")
    List<FactRecordEntity> findLiveInWindow(
            @Param("start") LocalDate start,
            @Param("end") LocalDate end
    );

    long countByDeletedFalse();

    List<FactRecordEntity> findByOrderIdInAndDeletedFalse(Collection<String> orderIds);
}
