package com.o2o.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Rows of one definition over a window, ordered by bucket then dimension key.
 * Both engines return this shape.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultSet {

    private String definitionId;
    private TimeWindow window;

    @Builder.Default
    private List<ResultRow> rows = new ArrayList<>();

    @JsonIgnore
    public boolean isEmpty() {
        return rows == null || rows.isEmpty();
    }
}
