package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Query against one aggregation definition.
 *
 * Filters are equality matches on group-by keys of the definition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineQueryRequest {

    private String definitionId;

    @Builder.Default
    private Map<String, String> filters = new TreeMap<>();

    private LocalDate start;
    private LocalDate end;

    public Map<String, String> getFilters() {
        if (filters == null) {
            return new TreeMap<>();
        }
        return filters;
    }

    /**
     * Window of the request; missing bounds default to the last 7 days ending {@code today}.
     */
    public TimeWindow toWindow(LocalDate today) {
        LocalDate effectiveEnd = end != null ? end : today;
        LocalDate effectiveStart = start != null ? start : effectiveEnd.minusDays(6);
        return TimeWindow.of(effectiveStart, effectiveEnd);
    }
}
