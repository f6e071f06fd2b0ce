package com.o2o.analytics.domain.engine;

import com.o2o.analytics.domain.model.AggregateSegment;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.ResultSet;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.service.AggregateSegmentService;
import com.o2o.analytics.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AggregateStoreEngineTest {

    private static final TimeWindow WINDOW =
            TimeWindow.of(LocalDate.parse("2026-01-01"), LocalDate.parse("2026-01-02"));

    @Mock
    private AggregateSegmentService segmentService;

    @InjectMocks
    private AggregateStoreEngine engine;

    private final AggregationDefinition definition = Fixtures.storeDaily();

    @Test
    void testQuery_SortsRowsAndSkipsEmptySegments() {
        // Given
        when(segmentService.findPublished(definition, WINDOW)).thenReturn(List.of(
                segment("S2", "2026-01-01", 2),
                segment("S1", "2026-01-02", 0),
                segment("S1", "2026-01-01", 3)));

        // When
        ResultSet result = engine.query(definition, Map.of(), WINDOW);

        // Then
        assertEquals(2, result.getRows().size());
        assertEquals("S1", result.getRows().get(0).getDimensions().get("store_id"));
        assertEquals("S2", result.getRows().get(1).getDimensions().get("store_id"));
        assertEquals(Fixtures.STORE_DAILY, result.getDefinitionId());
    }

    @Test
    void testQuery_FiltersOnDimensionValues() {
        // Given
        when(segmentService.findPublished(definition, WINDOW)).thenReturn(List.of(
                segment("S1", "2026-01-01", 3),
                segment("S2", "2026-01-01", 2)));

        // When
        ResultSet result = engine.query(definition, Map.of("store_id", "S2"), WINDOW);

        // Then
        assertEquals(1, result.getRows().size());
        assertEquals(2.0, result.getRows().get(0).getMeasures().get("order_count"));
    }

    @Test
    void testAvailability() {
        assertEquals(EngineType.AGGREGATE_STORE, engine.type());
        assertTrue(engine.available());
        assertTrue(engine.available(WINDOW));
    }

    private AggregateSegment segment(String store, String date, long rows) {
        return AggregateSegment.builder()
                .definitionId(Fixtures.STORE_DAILY)
                .dimensionKey(store)
                .bucket(LocalDate.parse(date))
                .dimensionValues(Map.of("store_id", store))
                .measures(Map.of("order_count", (double) rows))
                .sourceRowCount(rows)
                .version(1L)
                .build();
    }
}
