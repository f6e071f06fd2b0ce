package com.o2o.analytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One order line. Records are inserted or logically deleted, never changed.
 */
@Value
@Builder(toBuilder = true)
public class FactRecord {

    public static final String ORDER_ID = "order_id";
    public static final String STORE_ID = "store_id";
    public static final String CHANNEL = "channel";
    public static final String CATEGORY = "category";
    public static final String ORDER_DATE = "order_date";

    /**
     * Fields a definition may group by.
     */
    public static final List<String> DIMENSION_FIELDS = List.of(STORE_ID, CHANNEL, CATEGORY);

    String recordId;
    String orderId;
    String storeId;
    String channel;
    String category;
    LocalDate orderDate;

    @Singular
    Map<String, Double> measures;

    boolean deleted;

    /**
     * Insert time, or deletion time for a tombstone.
     */
    Instant updatedAt;

    public String dimension(String field) {
        switch (field) {
            case STORE_ID:
                return storeId;
            case CHANNEL:
                return channel;
            case CATEGORY:
                return category;
            default:
                throw new IllegalArgumentException("Unknown dimension: " + field);
        }
    }

    /**
     * Flat field view used as the expression root.
     */
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>(measures);
        fields.put(ORDER_ID, orderId);
        fields.put(STORE_ID, storeId);
        fields.put(CHANNEL, channel);
        fields.put(CATEGORY, category);
        fields.put(ORDER_DATE, orderDate != null ? orderDate.toString() : null);
        return fields;
    }
}
