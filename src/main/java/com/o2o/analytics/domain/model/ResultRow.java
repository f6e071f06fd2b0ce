package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultRow {

    @Builder.Default
    private Map<String, String> dimensions = new LinkedHashMap<>();

    private LocalDate bucket;

    @Builder.Default
    private Map<String, Double> measures = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> derived = new LinkedHashMap<>();

    private long sourceRowCount;
}
