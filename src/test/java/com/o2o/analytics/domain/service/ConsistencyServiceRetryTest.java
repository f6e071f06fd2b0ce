package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.exception.SegmentRebuildFailedException;
import com.o2o.analytics.domain.model.AggregateSegment;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.ConsistencyReport;
import com.o2o.analytics.domain.model.RepairResult;
import com.o2o.analytics.domain.model.SegmentKey;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.model.UnresolvedKey;
import com.o2o.analytics.infrastructure.persistence.repository.FactRecordRepository;
import com.o2o.analytics.support.Fixtures;
import com.o2o.analytics.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Bookkeeping of keys whose repair failed.
 */
@ExtendWith(MockitoExtension.class)
class ConsistencyServiceRetryTest {

    @Mock
    private FactRecordRepository factRecordRepository;

    @Mock
    private AggregateSegmentService segmentService;

    @Mock
    private DefinitionRegistry definitionRegistry;

    private final AggregationDefinition definition = Fixtures.storeDaily();
    private final SegmentKey key = SegmentKey.of("S1", LocalDate.parse("2026-01-02"));

    private MutableClock clock;
    private DataVersionRegistry versionRegistry;
    private ConsistencyService consistencyService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-10T08:00:00Z");
        versionRegistry = new DataVersionRegistry(clock);
        consistencyService = new ConsistencyService(factRecordRepository, segmentService, new AggregationEvaluator(),
                versionRegistry, definitionRegistry, new EngineProperties(), List.of(), clock);
    }

    @Test
    void testRepair_FailureRecordedAsUnresolved() {
        // Given
        when(segmentService.upsertSegment(definition, key))
                .thenThrow(new SegmentRebuildFailedException(definition.getId(), key, new IllegalStateException("db down")));
        long versionBefore = versionRegistry.current(definition.getId());

        // When
        RepairResult result = consistencyService.repair(definition, reportWithMissing(key));

        // Then
        assertTrue(result.getUnresolvedKeys().containsKey(key));
        assertFalse(result.changedAnything());
        assertEquals(versionBefore, versionRegistry.current(definition.getId()));

        UnresolvedKey unresolved = consistencyService.unresolved().get(definition.getId()).get(0);
        assertEquals(key, unresolved.getKey());
        assertEquals(1, unresolved.getAttempts());
        assertEquals(Instant.parse("2026-01-10T08:00:00Z"), unresolved.getFirstSeen());
    }

    @Test
    void testRetryUnresolved_CountsAttemptsUntilRepaired() {
        // Given
        when(segmentService.upsertSegment(definition, key))
                .thenThrow(new SegmentRebuildFailedException(definition.getId(), key, new IllegalStateException("db down")))
                .thenThrow(new SegmentRebuildFailedException(definition.getId(), key, new IllegalStateException("db down")))
                .thenReturn(Optional.of(AggregateSegment.builder()
                        .definitionId(definition.getId()).dimensionKey("S1").bucket(key.getBucket()).build()));
        consistencyService.repair(definition, reportWithMissing(key));

        // When
        clock.advance(Duration.ofHours(1));
        consistencyService.retryUnresolved(definition);
        UnresolvedKey afterSecond = consistencyService.unresolved().get(definition.getId()).get(0);
        clock.advance(Duration.ofHours(1));
        RepairResult third = consistencyService.retryUnresolved(definition);

        // Then
        assertEquals(2, afterSecond.getAttempts());
        assertEquals(Instant.parse("2026-01-10T08:00:00Z"), afterSecond.getFirstSeen());
        assertEquals(Instant.parse("2026-01-10T09:00:00Z"), afterSecond.getLastAttempt());
        assertTrue(third.getRepairedKeys().contains(key));
        assertTrue(consistencyService.unresolved().isEmpty());
    }

    @Test
    void testRetryUnresolved_NothingPending() {
        // When
        RepairResult result = consistencyService.retryUnresolved(definition);

        // Then
        assertFalse(result.changedAnything());
        verifyNoInteractions(segmentService);
    }

    @Test
    void testCheckAndRepairAll_OneDefinitionFailingDoesNotStopOthers() {
        // Given
        AggregationDefinition monthly = Fixtures.storeMonthly();
        when(definitionRegistry.all()).thenReturn(List.of(definition, monthly));
        when(factRecordRepository.findInWindow(any(), any()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(List.of());
        TimeWindow window = TimeWindow.of(LocalDate.parse("2026-01-01"), LocalDate.parse("2026-01-07"));

        // When
        List<RepairResult> results = consistencyService.checkAndRepairAll(window);

        // Then
        assertEquals(1, results.size());
        assertEquals(Fixtures.STORE_MONTHLY, results.get(0).getDefinitionId());
    }

    private ConsistencyReport reportWithMissing(SegmentKey missing) {
        ConsistencyReport report = ConsistencyReport.builder()
                .definitionId(definition.getId())
                .window(TimeWindow.day(missing.getBucket()))
                .build();
        report.getMissingKeys().add(missing);
        return report;
    }
}
