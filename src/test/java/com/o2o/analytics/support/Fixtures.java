package com.o2o.analytics.support;

import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.BucketGranularity;
import com.o2o.analytics.domain.model.DerivedFieldSpec;
import com.o2o.analytics.domain.model.FactRecord;
import com.o2o.analytics.domain.model.MeasureSpec;
import com.o2o.analytics.domain.model.Reducer;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Definitions and records shared by the tests.
 */
public final class Fixtures {

    public static final String STORE_DAILY = "store_daily_summary";
    public static final String STORE_MONTHLY = "store_monthly_summary";

    private Fixtures() {
    }

    public static AggregationDefinition storeDaily() {
        return AggregationDefinition.builder()
                .id(STORE_DAILY)
                .description("Daily store summary")
                .groupByField(FactRecord.STORE_ID)
                .bucket(BucketGranularity.DAY)
                .primaryMeasure("order_count")
                .measure(MeasureSpec.builder()
                        .name("order_count").source("order_id").reducer(Reducer.COUNT_DISTINCT).build())
                .measure(MeasureSpec.builder()
                        .name("total_revenue").source("(actual_price ?: 0) * (quantity ?: 1)").reducer(Reducer.SUM).build())
                .measure(MeasureSpec.builder()
                        .name("total_delivery_fee").source("delivery_fee ?: 0").reducer(Reducer.MAX).orderLevel(true).build())
                .derivedField(new DerivedFieldSpec("avg_order_value",
                        "order_count > 0 ? total_revenue / order_count : 0"))
                .build();
    }

    public static AggregationDefinition storeMonthly() {
        return AggregationDefinition.builder()
                .id(STORE_MONTHLY)
                .groupByField(FactRecord.STORE_ID)
                .bucket(BucketGranularity.MONTH)
                .filterExpression("channel != 'test'")
                .measure(MeasureSpec.builder()
                        .name("order_count").source("order_id").reducer(Reducer.COUNT_DISTINCT).build())
                .measure(MeasureSpec.builder()
                        .name("total_revenue").source("(actual_price ?: 0) * (quantity ?: 1)").reducer(Reducer.SUM).build())
                .build();
    }

    /**
     * One order line with a single item, delivered through "meituan".
     */
    public static FactRecord record(String orderId, String storeId, String date, double price) {
        return FactRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .orderId(orderId)
                .storeId(storeId)
                .channel("meituan")
                .category("drinks")
                .orderDate(LocalDate.parse(date))
                .measure("actual_price", price)
                .measure("quantity", 1.0)
                .updatedAt(Instant.parse(date + "T12:00:00Z"))
                .build();
    }
}
