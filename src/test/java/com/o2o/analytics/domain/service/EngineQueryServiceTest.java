package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.engine.ColumnarSnapshotEngine;
import com.o2o.analytics.domain.exception.DefinitionNotFoundException;
import com.o2o.analytics.domain.exception.InvalidQueryException;
import com.o2o.analytics.domain.model.AggregateSegment;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.EngineQueryRequest;
import com.o2o.analytics.domain.model.EngineQueryResponse;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.ResultRow;
import com.o2o.analytics.domain.model.ResultSet;
import com.o2o.analytics.domain.model.RoutedResult;
import com.o2o.analytics.domain.model.SegmentKey;
import com.o2o.analytics.domain.model.SlowQueryRecord;
import com.o2o.analytics.domain.model.SlowQueryStats;
import com.o2o.analytics.domain.model.SyncJobKey;
import com.o2o.analytics.domain.model.SyncMode;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.infrastructure.cache.LocalCacheStore;
import com.o2o.analytics.infrastructure.cache.VersionedQueryCache;
import com.o2o.analytics.support.Fixtures;
import com.o2o.analytics.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EngineQueryService.
 *
 * Covers the versioned cache in front of the router and request validation.
 */
@ExtendWith(MockitoExtension.class)
class EngineQueryServiceTest {

    private static final TimeWindow WINDOW =
            TimeWindow.of(LocalDate.parse("2026-01-01"), LocalDate.parse("2026-01-03"));

    @Mock
    private DefinitionRegistry definitionRegistry;

    @Mock
    private QueryRouter router;

    @Mock
    private AggregateSegmentService segmentService;

    @Mock
    private ConsistencyService consistencyService;

    @Mock
    private SyncScheduler syncScheduler;

    @Mock
    private ColumnarSnapshotEngine columnarEngine;

    private final AggregationDefinition definition = Fixtures.storeDaily();

    private EngineProperties properties;
    private MeterRegistry meterRegistry;
    private DataVersionRegistry versionRegistry;
    private VersionedQueryCache cache;
    private EngineQueryService queryService;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-01-10T08:00:00Z");
        properties = new EngineProperties();
        meterRegistry = new SimpleMeterRegistry();
        versionRegistry = new DataVersionRegistry(clock);
        cache = new VersionedQueryCache(new LocalCacheStore(100, clock), versionRegistry, properties, meterRegistry, clock);
        queryService = new EngineQueryService(definitionRegistry, router, cache, versionRegistry, segmentService,
                consistencyService, syncScheduler, columnarEngine, new EngineStats(meterRegistry),
                new SlowQueryTracker(properties, meterRegistry, clock), properties, meterRegistry, clock);
    }

    @Test
    void testQuery_CacheMiss() {
        // Given
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        when(router.route(definition, Map.of(), WINDOW))
                .thenReturn(new RoutedResult(resultSet(3), EngineType.AGGREGATE_STORE, 4));

        // When
        EngineQueryResponse result = queryService.query(request(Map.of()));

        // Then
        assertFalse(result.isCached());
        assertEquals(EngineType.AGGREGATE_STORE, result.getEngineUsed());
        assertEquals(versionRegistry.current(Fixtures.STORE_DAILY), result.getDataVersion());
        assertEquals(1, result.getResultSet().getRows().size());
        assertNotNull(meterRegistry.find("engine.request").tag("cached", "false").timer());
    }

    @Test
    void testQuery_CacheHit() {
        // Given
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        when(router.route(definition, Map.of(), WINDOW))
                .thenReturn(new RoutedResult(resultSet(3), EngineType.COLUMNAR_SNAPSHOT, 12));
        queryService.query(request(Map.of()));

        // When
        EngineQueryResponse result = queryService.query(request(Map.of()));

        // Then
        assertTrue(result.isCached());
        assertEquals(EngineType.COLUMNAR_SNAPSHOT, result.getEngineUsed());
        verify(router, times(1)).route(any(), any(), any());
    }

    @Test
    void testQuery_VersionBumpForcesRecompute() {
        // Given
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        when(router.route(definition, Map.of(), WINDOW))
                .thenReturn(new RoutedResult(resultSet(3), EngineType.AGGREGATE_STORE, 4))
                .thenReturn(new RoutedResult(resultSet(2), EngineType.AGGREGATE_STORE, 4));
        EngineQueryResponse before = queryService.query(request(Map.of()));

        // When
        versionRegistry.bump(Fixtures.STORE_DAILY);
        EngineQueryResponse after = queryService.query(request(Map.of()));

        // Then
        assertFalse(after.isCached());
        assertTrue(after.getDataVersion() > before.getDataVersion());
        assertEquals(2, after.getResultSet().getRows().get(0).getSourceRowCount());
    }

    @Test
    void testQuery_FilterOnNonGroupByFieldRejected() {
        // Given
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);

        // When / Then
        assertThrows(InvalidQueryException.class, () -> queryService.query(request(Map.of("channel", "meituan"))));
        verifyNoInteractions(router);
    }

    @Test
    void testQuery_InvertedWindowRejected() {
        // Given
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        EngineQueryRequest request = EngineQueryRequest.builder()
                .definitionId(Fixtures.STORE_DAILY)
                .start(LocalDate.parse("2026-01-05"))
                .end(LocalDate.parse("2026-01-01"))
                .build();

        // When / Then
        assertThrows(InvalidQueryException.class, () -> queryService.query(request));
    }

    @Test
    void testQuery_UnknownDefinition() {
        // Given
        when(definitionRegistry.require("nope")).thenThrow(new DefinitionNotFoundException("nope"));

        // When / Then
        assertThrows(DefinitionNotFoundException.class,
                () -> queryService.query(EngineQueryRequest.builder().definitionId("nope").build()));
    }

    @Test
    void testQuery_MonthlyWindowAlignedToBuckets() {
        // Given
        AggregationDefinition monthly = Fixtures.storeMonthly();
        when(definitionRegistry.require(Fixtures.STORE_MONTHLY)).thenReturn(monthly);
        TimeWindow aligned = TimeWindow.of(LocalDate.parse("2026-01-01"), LocalDate.parse("2026-02-28"));
        when(router.route(monthly, Map.of(), aligned))
                .thenReturn(new RoutedResult(ResultSet.builder().definitionId(Fixtures.STORE_MONTHLY).window(aligned).build(),
                        EngineType.AGGREGATE_STORE, 1));

        // When
        EngineQueryResponse result = queryService.query(EngineQueryRequest.builder()
                .definitionId(Fixtures.STORE_MONTHLY)
                .start(LocalDate.parse("2026-01-15"))
                .end(LocalDate.parse("2026-02-03"))
                .build());

        // Then
        assertEquals(aligned, result.getResultSet().getWindow());
    }

    @Test
    void testInvalidate_RebuildsKeyAndBumpsVersion() {
        // Given
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        AggregateSegment segment = AggregateSegment.builder()
                .definitionId(Fixtures.STORE_DAILY).dimensionKey("S1").bucket(LocalDate.parse("2026-01-02")).build();
        when(segmentService.getSegments(definition, "S1")).thenReturn(List.of(segment));
        when(segmentService.upsertSegment(definition, SegmentKey.of("S1", LocalDate.parse("2026-01-02"))))
                .thenReturn(Optional.of(segment));
        long before = versionRegistry.current(Fixtures.STORE_DAILY);

        // When
        long after = queryService.invalidate(Fixtures.STORE_DAILY, "S1");

        // Then
        assertTrue(after > before);
        assertEquals(after, versionRegistry.current(Fixtures.STORE_DAILY));
        verify(segmentService).upsertSegment(definition, segment.key());
    }

    @Test
    void testQuery_SlowQueryShowsInStatus() {
        // Given
        properties.getSlowQuery().setThreshold(Duration.ZERO);
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        when(router.route(definition, Map.of("store_id", "S1"), WINDOW))
                .thenReturn(new RoutedResult(resultSet(1), EngineType.AGGREGATE_STORE, 4));

        // When
        queryService.query(request(Map.of("store_id", "S1")));
        SlowQueryStats slow = queryService.status().getSlowQueries();

        // Then
        assertEquals(1, slow.getSlowQueries());
        assertEquals(Map.of(Fixtures.STORE_DAILY, 1L), slow.getSlowByDefinition());
        SlowQueryRecord recorded = slow.getRecent().get(0);
        assertEquals(EngineType.AGGREGATE_STORE, recorded.getEngine());
        assertEquals(WINDOW, recorded.getWindow());
        assertEquals(Map.of("store_id", "S1"), recorded.getFilters());
        assertFalse(recorded.isCached());
        assertEquals(1.0, meterRegistry.get("engine.query.slow").counter().count());
    }

    @Test
    void testTriggerSync_DefaultsToLookbackWindow() {
        // Given
        TimeWindow lookback = TimeWindow.of(LocalDate.parse("2026-01-04"), LocalDate.parse("2026-01-10"));
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        when(syncScheduler.lookbackWindow()).thenReturn(lookback);

        // When
        SyncJobKey key = queryService.triggerSync(Fixtures.STORE_DAILY, null, null, SyncMode.FULL);

        // Then
        assertEquals(SyncJobKey.definition(Fixtures.STORE_DAILY, lookback), key);
        verify(syncScheduler).submit(key, SyncMode.FULL);
    }

    private EngineQueryRequest request(Map<String, String> filters) {
        return EngineQueryRequest.builder()
                .definitionId(Fixtures.STORE_DAILY)
                .filters(filters)
                .start(WINDOW.getStart())
                .end(WINDOW.getEnd())
                .build();
    }

    private ResultSet resultSet(long rows) {
        return ResultSet.builder()
                .definitionId(Fixtures.STORE_DAILY)
                .window(WINDOW)
                .rows(List.of(ResultRow.builder()
                        .dimensions(Map.of("store_id", "S1"))
                        .bucket(WINDOW.getStart())
                        .measures(Map.of("order_count", (double) rows))
                        .sourceRowCount(rows)
                        .build()))
                .build();
    }
}
