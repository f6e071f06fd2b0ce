package com.o2o.analytics.domain.service;

import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.DerivedFieldSpec;
import com.o2o.analytics.domain.model.FactRecord;
import com.o2o.analytics.domain.model.MeasureSpec;
import com.o2o.analytics.domain.model.Reducer;
import com.o2o.analytics.domain.model.ResultRow;
import com.o2o.analytics.domain.model.SegmentKey;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Evaluates aggregation definitions over fact records.
 *
 * Shared by the aggregate store (segment rebuilds), the columnar snapshot
 * (query-time aggregation) and the consistency checker, so every path reduces
 * records identically. Records are sorted by order id then record id before
 * reducing, which makes floating point sums reproducible across engines.
 *
 * Expressions are SpEL, parsed once and cached. The evaluation context only
 * resolves record fields; no types, beans or methods are reachable.
 */
@Slf4j
@Component
public class AggregationEvaluator {

    private static final Comparator<FactRecord> REDUCE_ORDER = Comparator
            .comparing(FactRecord::getOrderId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(FactRecord::getRecordId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();
    private final EvaluationContext context = SimpleEvaluationContext
            .forPropertyAccessors(new FieldMapAccessor())
            .build();

    /**
     * Checks a definition before it is registered.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate(AggregationDefinition definition) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new IllegalArgumentException("Definition id is required");
        }
        if (definition.getMeasures().isEmpty()) {
            throw new IllegalArgumentException("Definition " + definition.getId() + " has no measures");
        }
        if (definition.getBucket() == null) {
            throw new IllegalArgumentException("Definition " + definition.getId() + " has no bucket granularity");
        }
        for (String field : definition.getGroupBy()) {
            if (!FactRecord.DIMENSION_FIELDS.contains(field)) {
                throw new IllegalArgumentException("Definition " + definition.getId()
                        + " groups by unknown field '" + field + "', allowed: " + FactRecord.DIMENSION_FIELDS);
            }
        }

        Set<String> names = new HashSet<>();
        for (MeasureSpec measure : definition.getMeasures()) {
            if (!names.add(measure.getName())) {
                throw new IllegalArgumentException("Duplicate field '" + measure.getName() + "' in " + definition.getId());
            }
            if (measure.getReducer() == null) {
                throw new IllegalArgumentException("Measure '" + measure.getName() + "' has no reducer");
            }
            parse(measure.getSource());
        }
        for (DerivedFieldSpec derived : definition.getDerivedFields()) {
            if (!names.add(derived.getName())) {
                throw new IllegalArgumentException("Duplicate field '" + derived.getName() + "' in " + definition.getId());
            }
            parse(derived.getFormula());
        }
        if (definition.hasFilter()) {
            parse(definition.getFilterExpression());
        }

        String primary = definition.primaryMeasureName();
        boolean primaryIsMeasure = definition.getMeasures().stream().anyMatch(m -> m.getName().equals(primary));
        if (!primaryIsMeasure) {
            throw new IllegalArgumentException("Primary measure '" + primary + "' is not a measure of " + definition.getId());
        }
    }

    public boolean accepts(AggregationDefinition definition, FactRecord record) {
        if (!definition.hasFilter()) {
            return true;
        }
        Boolean accepted = parse(definition.getFilterExpression()).getValue(context, record.fields(), Boolean.class);
        return Boolean.TRUE.equals(accepted);
    }

    /**
     * Records passing the definition filter. Tombstones are kept.
     */
    public List<FactRecord> applicable(AggregationDefinition definition, List<FactRecord> records) {
        return records.stream()
                .filter(r -> accepts(definition, r))
                .collect(Collectors.toList());
    }

    public Map<String, String> dimensionValues(AggregationDefinition definition, FactRecord record) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String field : definition.getGroupBy()) {
            values.put(field, record.dimension(field));
        }
        return values;
    }

    public String dimensionKey(AggregationDefinition definition, FactRecord record) {
        return definition.getGroupBy().stream()
                .map(field -> {
                    String value = record.dimension(field);
                    return value == null ? "" : value;
                })
                .collect(Collectors.joining(SegmentKey.KEY_SEPARATOR));
    }

    public SegmentKey segmentKey(AggregationDefinition definition, FactRecord record) {
        return SegmentKey.of(dimensionKey(definition, record), definition.getBucket().bucketOf(record.getOrderDate()));
    }

    /**
     * Groups records by segment key; the input order inside each group is kept.
     */
    public Map<SegmentKey, List<FactRecord>> groupBySegment(AggregationDefinition definition, List<FactRecord> records) {
        Map<SegmentKey, List<FactRecord>> groups = new TreeMap<>();
        for (FactRecord record : records) {
            groups.computeIfAbsent(segmentKey(definition, record), k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    /**
     * Reduces live records into measures and derived fields.
     * Callers pass records already filtered by the definition.
     */
    public ReducedValues reduce(AggregationDefinition definition, List<FactRecord> liveRecords) {
        List<FactRecord> ordered = sorted(liveRecords);

        Map<String, Double> measures = new LinkedHashMap<>();
        for (MeasureSpec measure : definition.getMeasures()) {
            measures.put(measure.getName(), reduceSorted(measure, ordered));
        }

        Map<String, Double> derived = new LinkedHashMap<>();
        Map<String, Object> scope = new LinkedHashMap<>(measures);
        for (DerivedFieldSpec field : definition.getDerivedFields()) {
            Object value = parse(field.getFormula()).getValue(context, scope);
            double result = value == null ? 0.0 : finite(Reducer.toDouble(value));
            derived.put(field.getName(), result);
            scope.put(field.getName(), result);
        }
        return new ReducedValues(measures, derived);
    }

    public double reduceMeasure(AggregationDefinition definition, String measureName, List<FactRecord> liveRecords) {
        MeasureSpec measure = definition.getMeasures().stream()
                .filter(m -> m.getName().equals(measureName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown measure '" + measureName + "' in " + definition.getId()));
        return reduceSorted(measure, sorted(liveRecords));
    }

    /**
     * Full query-time aggregation: filter, drop tombstones, group, reduce.
     * Rows come back ordered by bucket then dimension key.
     */
    public List<ResultRow> aggregate(AggregationDefinition definition, List<FactRecord> records) {
        List<FactRecord> live = records.stream()
                .filter(r -> !r.isDeleted())
                .filter(r -> accepts(definition, r))
                .collect(Collectors.toList());

        List<ResultRow> rows = new ArrayList<>();
        for (Map.Entry<SegmentKey, List<FactRecord>> group : groupBySegment(definition, live).entrySet()) {
            List<FactRecord> members = group.getValue();
            ReducedValues values = reduce(definition, members);
            rows.add(ResultRow.builder()
                    .dimensions(dimensionValues(definition, members.get(0)))
                    .bucket(group.getKey().getBucket())
                    .measures(values.getMeasures())
                    .derived(values.getDerived())
                    .sourceRowCount(members.size())
                    .build());
        }
        return rows;
    }

    private double reduceSorted(MeasureSpec measure, List<FactRecord> ordered) {
        Expression source = parse(measure.getSource());
        if (!measure.isOrderLevel()) {
            List<Object> values = new ArrayList<>(ordered.size());
            for (FactRecord record : ordered) {
                values.add(source.getValue(context, record.fields()));
            }
            return finite(measure.getReducer().reduce(values));
        }

        // reduce inside each order, then sum the orders
        Map<String, List<Object>> perOrder = new LinkedHashMap<>();
        for (FactRecord record : ordered) {
            String orderId = record.getOrderId() == null ? "" : record.getOrderId();
            perOrder.computeIfAbsent(orderId, k -> new ArrayList<>()).add(source.getValue(context, record.fields()));
        }
        double total = 0.0;
        for (List<Object> values : perOrder.values()) {
            total += measure.getReducer().reduce(values);
        }
        return finite(total);
    }

    private List<FactRecord> sorted(List<FactRecord> records) {
        List<FactRecord> ordered = new ArrayList<>(records);
        ordered.sort(REDUCE_ORDER);
        return ordered;
    }

    private Expression parse(String expression) {
        return expressionCache.computeIfAbsent(expression, e -> {
            try {
                return parser.parseExpression(e);
            } catch (ParseException ex) {
                throw new IllegalArgumentException("Invalid expression '" + e + "': " + ex.getMessage(), ex);
            }
        });
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    @Value
    public static class ReducedValues {
        Map<String, Double> measures;
        Map<String, Double> derived;
    }
}
