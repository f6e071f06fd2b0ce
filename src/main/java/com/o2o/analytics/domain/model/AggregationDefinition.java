package com.o2o.analytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Declarative description of an aggregate: which records, grouped how, reduced how.
 *
 * Expressions ({@code filterExpression}, measure sources, derived formulas) are
 * SpEL evaluated against record fields, so a new aggregate is pure configuration.
 * Instances are immutable; re-registering an id replaces the whole definition.
 */
@Value
@Builder
public class AggregationDefinition {

    String id;
    String description;

    @Singular("groupByField")
    List<String> groupBy;

    @Builder.Default
    BucketGranularity bucket = BucketGranularity.DAY;

    /**
     * Optional boolean expression; records it rejects never contribute.
     */
    String filterExpression;

    @Singular
    List<MeasureSpec> measures;

    @Singular
    List<DerivedFieldSpec> derivedFields;

    /**
     * Measure compared by the consistency check; defaults to the first measure.
     */
    String primaryMeasure;

    public String primaryMeasureName() {
        if (primaryMeasure != null && !primaryMeasure.isBlank()) {
            return primaryMeasure;
        }
        return measures.isEmpty() ? null : measures.get(0).getName();
    }

    public boolean hasFilter() {
        return filterExpression != null && !filterExpression.isBlank();
    }
}
