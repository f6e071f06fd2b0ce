package com.o2o.analytics.infrastructure.persistence.entity;

import com.o2o.analytics.domain.model.FactRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
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
 * One order line of the raw fact table.
 *
 * Rows are only inserted or logically deleted. A logical delete sets
 * {@code deleted} and moves {@code updatedAt} to the deletion time, which
 * is what lets segment versions advance on deletes.
 *
 * Indexing Strategy:
 * - order_date for window scans (rebuilds, consistency checks, snapshot export)
 * - (store_id, order_date) for store-scoped rebuilds
 * - order_id for deletes by order
 */
@Entity
@Table(name = "fact_records", indexes = {
    @Index(name = "idx_fact_order_date", columnList = "orderDate"),
    @Index(name = "idx_fact_store_date", columnList = "storeId,orderDate"),
    @Index(name = "idx_fact_order_id", columnList = "orderId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactRecordEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID recordId;

    @Column(nullable = false, length = 64)
    private String orderId;

    @Column(nullable = false, length = 64)
    private String storeId;

    @Column(length = 32)
    private String channel;

    @Column(length = 100)
    private String category;

    @Column(nullable = false)
    private LocalDate orderDate;

    @Convert(converter = JsonMapConverters.DoubleMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Double> measures = new LinkedHashMap<>();

    @Column(nullable = false)
    private boolean deleted;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (recordId == null) {
            recordId = UUID.randomUUID();
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public void markDeleted(Instant at) {
        this.deleted = true;
        this.updatedAt = at;
    }

    /**
     * Overwrites the stored line with a re-imported version; {@code createdAt} is kept.
     */
    public void replaceWith(FactRecord record) {
        this.orderId = record.getOrderId();
        this.storeId = record.getStoreId();
        this.channel = record.getChannel();
        this.category = record.getCategory();
        this.orderDate = record.getOrderDate();
        this.measures = new LinkedHashMap<>(record.getMeasures());
        this.deleted = record.isDeleted();
        this.updatedAt = record.getUpdatedAt();
    }

    public static FactRecordEntity from(FactRecord record) {
        return FactRecordEntity.builder()
                .recordId(record.getRecordId() != null ? UUID.fromString(record.getRecordId()) : null)
                .orderId(record.getOrderId())
                .storeId(record.getStoreId())
                .channel(record.getChannel())
                .category(record.getCategory())
                .orderDate(record.getOrderDate())
                .measures(new LinkedHashMap<>(record.getMeasures()))
                .deleted(record.isDeleted())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    public FactRecord toRecord() {
        return FactRecord.builder()
                .recordId(recordId != null ? recordId.toString() : null)
                .orderId(orderId)
                .storeId(storeId)
                .channel(channel)
                .category(category)
                .orderDate(orderDate)
                .measures(measures != null ? measures : Map.of())
                .deleted(deleted)
                .updatedAt(updatedAt)
                .build();
    }
}
