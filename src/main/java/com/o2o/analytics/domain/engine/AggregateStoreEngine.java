package com.o2o.analytics.domain.engine;

import com.o2o.analytics.domain.model.AggregateSegment;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.ResultRow;
import com.o2o.analytics.domain.model.ResultSet;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.service.AggregateSegmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Serves queries from published segments. Always available; it is the fallback path.
 *
 * Segments with no live rows (every record of the key deleted) are kept for
 * versioning but not returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AggregateStoreEngine implements QueryEngine {

    private final AggregateSegmentService segmentService;

    @Override
    public EngineType type() {
        return EngineType.AGGREGATE_STORE;
    }

    @Override
    public ResultSet query(AggregationDefinition definition, Map<String, String> filters, TimeWindow window) {
        List<ResultRow> rows = segmentService.findPublished(definition, window).stream()
                .filter(segment -> segment.getSourceRowCount() > 0)
                .filter(segment -> matches(segment, filters))
                .sorted((a, b) -> a.key().compareTo(b.key()))
                .map(AggregateSegment::toRow)
                .collect(Collectors.toList());

        log.debug("Aggregate store returned {} rows for {} over {}", rows.size(), definition.getId(), window);
        return ResultSet.builder()
                .definitionId(definition.getId())
                .window(window)
                .rows(rows)
                .build();
    }

    @Override
    public boolean available() {
        return true;
    }

    private static boolean matches(AggregateSegment segment, Map<String, String> filters) {
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            if (!Objects.equals(segment.getDimensionValues().get(filter.getKey()), filter.getValue())) {
                return false;
            }
        }
        return true;
    }
}
