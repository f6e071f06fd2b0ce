package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.engine.ColumnarSnapshotEngine;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.DataMutationEvent;
import com.o2o.analytics.domain.model.DataRefreshedEvent;
import com.o2o.analytics.domain.model.DefinitionRegisteredEvent;
import com.o2o.analytics.domain.model.SegmentKey;
import com.o2o.analytics.domain.model.SyncJob;
import com.o2o.analytics.domain.model.SyncJobKey;
import com.o2o.analytics.domain.model.SyncMode;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.model.WindowRebuildResult;
import com.o2o.analytics.infrastructure.persistence.repository.FactRecordRepository;
import com.o2o.analytics.support.Fixtures;
import com.o2o.analytics.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {

    private static final TimeWindow DAY_ONE = TimeWindow.day(LocalDate.parse("2026-01-01"));

    @Mock
    private DefinitionRegistry definitionRegistry;

    @Mock
    private AggregateSegmentService segmentService;

    @Mock
    private ColumnarSnapshotEngine columnarEngine;

    @Mock
    private ConsistencyService consistencyService;

    @Mock
    private QueryRouter router;

    @Mock
    private FactRecordRepository factRecordRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final AggregationDefinition definition = Fixtures.storeDaily();

    private MutableClock clock;
    private DataVersionRegistry versionRegistry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-10T08:00:00Z");
        versionRegistry = new DataVersionRegistry(clock);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testSubmit_SameKeyRunsInSubmissionOrder() throws Exception {
        // Given
        SyncScheduler scheduler = scheduler();
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        CountDownLatch release = new CountDownLatch(1);
        List<Boolean> calls = new CopyOnWriteArrayList<>();
        when(segmentService.rebuildWindow(eq(definition), eq(DAY_ONE), anyBoolean())).thenAnswer(invocation -> {
            boolean force = invocation.getArgument(2);
            calls.add(force);
            if (force) {
                release.await(5, TimeUnit.SECONDS);
            }
            return new WindowRebuildResult(definition.getId(), DAY_ONE);
        });
        SyncJobKey key = SyncJobKey.definition(Fixtures.STORE_DAILY, DAY_ONE);

        // When
        CompletableFuture<SyncJob> first = scheduler.submit(key, SyncMode.FULL);
        CompletableFuture<SyncJob> second = scheduler.submit(key, SyncMode.INCREMENTAL);
        Thread.sleep(200);
        int startedBeforeRelease = calls.size();
        release.countDown();
        SyncJob firstJob = first.get(5, TimeUnit.SECONDS);
        SyncJob secondJob = second.get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(1, startedBeforeRelease);
        assertEquals(List.of(true, false), calls);
        assertEquals(SyncJob.JobStatus.COMPLETED, firstJob.getStatus());
        assertEquals(SyncJob.JobStatus.COMPLETED, secondJob.getStatus());
        assertFalse(secondJob.getStartedAt().isBefore(firstJob.getCompletedAt()));
    }

    @Test
    void testSubmit_DifferentKeysDoNotWaitForEachOther() throws Exception {
        // Given
        SyncScheduler scheduler = scheduler();
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        CountDownLatch release = new CountDownLatch(1);
        TimeWindow dayTwo = TimeWindow.day(LocalDate.parse("2026-01-02"));
        when(segmentService.rebuildWindow(eq(definition), eq(DAY_ONE), anyBoolean())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return new WindowRebuildResult(definition.getId(), DAY_ONE);
        });
        when(segmentService.rebuildWindow(eq(definition), eq(dayTwo), anyBoolean()))
                .thenReturn(new WindowRebuildResult(definition.getId(), dayTwo));

        // When
        CompletableFuture<SyncJob> blocked = scheduler.submit(SyncJobKey.definition(Fixtures.STORE_DAILY, DAY_ONE), SyncMode.FULL);
        SyncJob other = scheduler.submit(SyncJobKey.definition(Fixtures.STORE_DAILY, dayTwo), SyncMode.FULL)
                .get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(SyncJob.JobStatus.COMPLETED, other.getStatus());
        assertFalse(blocked.isDone());
        release.countDown();
        assertEquals(SyncJob.JobStatus.COMPLETED, blocked.get(5, TimeUnit.SECONDS).getStatus());
    }

    @Test
    void testRunJob_SegmentFailuresKeepJobForHourlyRetry() {
        // Given
        SyncScheduler scheduler = directScheduler();
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        when(definitionRegistry.all()).thenReturn(List.of());
        WindowRebuildResult partial = new WindowRebuildResult(definition.getId(), DAY_ONE);
        partial.recordUpserted();
        partial.getFailures().put(SegmentKey.of("S1", DAY_ONE.getStart()), "lock timeout");
        WindowRebuildResult clean = new WindowRebuildResult(definition.getId(), DAY_ONE);
        clean.recordUpserted();
        when(segmentService.rebuildWindow(definition, DAY_ONE, true)).thenReturn(partial, clean);
        long versionBefore = versionRegistry.current(definition.getId());

        // When
        SyncJob failed = scheduler.submit(SyncJobKey.definition(Fixtures.STORE_DAILY, DAY_ONE), SyncMode.FULL).join();
        List<SyncJob> pending = scheduler.failedJobs();
        scheduler.hourlyRebuild();

        // Then
        assertEquals(SyncJob.JobStatus.FAILED, failed.getStatus());
        assertEquals(1, failed.getFailedSegments());
        assertTrue(versionRegistry.current(definition.getId()) > versionBefore);
        assertEquals(1, pending.size());
        assertTrue(scheduler.failedJobs().isEmpty());
        assertEquals(SyncJob.JobStatus.COMPLETED, scheduler.recentJobs().get(0).getStatus());
        verify(segmentService, times(2)).rebuildWindow(definition, DAY_ONE, true);
    }

    @Test
    void testRunJob_UnchangedWindowKeepsVersion() {
        // Given
        SyncScheduler scheduler = directScheduler();
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        WindowRebuildResult unchanged = new WindowRebuildResult(definition.getId(), DAY_ONE);
        unchanged.recordUnchanged();
        when(segmentService.rebuildWindow(definition, DAY_ONE, false)).thenReturn(unchanged);
        long versionBefore = versionRegistry.current(definition.getId());

        // When
        SyncJob job = scheduler.submit(SyncJobKey.definition(Fixtures.STORE_DAILY, DAY_ONE), SyncMode.INCREMENTAL).join();

        // Then
        assertEquals(SyncJob.JobStatus.COMPLETED, job.getStatus());
        assertEquals(versionBefore, versionRegistry.current(definition.getId()));
    }

    @Test
    void testOnDataMutation_RefreshesSnapshotRebuildsAndChecks() {
        // Given
        SyncScheduler scheduler = directScheduler();
        when(columnarEngine.isInitialized()).thenReturn(true);
        when(definitionRegistry.all()).thenReturn(List.of(definition));
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        when(segmentService.rebuildWindow(definition, DAY_ONE, false))
                .thenReturn(new WindowRebuildResult(definition.getId(), DAY_ONE));
        when(factRecordRepository.countByDeletedFalse()).thenReturn(42L);

        // When
        scheduler.onDataMutation(DataMutationEvent.allDefinitions(DataMutationEvent.MutationType.DELETE, DAY_ONE, 1));

        // Then
        verify(columnarEngine).refresh(DAY_ONE);
        InOrder inOrder = inOrder(segmentService, consistencyService, router);
        inOrder.verify(segmentService).rebuildWindow(definition, DAY_ONE, false);
        inOrder.verify(consistencyService).checkAndRepair(definition, DAY_ONE);
        inOrder.verify(router).updateRecordCount(42L);
    }

    @Test
    void testOnDataMutation_VersionMovesPastSnapshotRefresh() {
        // Given
        SyncScheduler scheduler = scheduler();
        when(columnarEngine.isInitialized()).thenReturn(true);
        when(definitionRegistry.all()).thenReturn(List.of(definition));
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        WindowRebuildResult changed = new WindowRebuildResult(definition.getId(), DAY_ONE);
        changed.recordUpserted();
        when(segmentService.rebuildWindow(definition, DAY_ONE, false)).thenReturn(changed);
        List<Long> seenBeforePublish = new CopyOnWriteArrayList<>();
        when(columnarEngine.refresh(DAY_ONE)).thenAnswer(invocation -> {
            Thread.sleep(300);
            seenBeforePublish.add(versionRegistry.current(definition.getId()));
            return null;
        });
        when(factRecordRepository.countByDeletedFalse()).thenReturn(3L);

        // When
        scheduler.onDataMutation(DataMutationEvent.allDefinitions(DataMutationEvent.MutationType.IMPORT, DAY_ONE, 1));

        // Then: a query cached while the old generation served must not match the final version
        assertEquals(1, seenBeforePublish.size());
        assertTrue(versionRegistry.current(definition.getId()) > seenBeforePublish.get(0));
    }

    @Test
    void testSubmit_ColumnarRefreshBumpsEveryDefinition() {
        // Given
        SyncScheduler scheduler = directScheduler();
        AggregationDefinition monthly = Fixtures.storeMonthly();
        when(definitionRegistry.all()).thenReturn(List.of(definition, monthly));
        long dailyBefore = versionRegistry.current(definition.getId());
        long monthlyBefore = versionRegistry.current(monthly.getId());

        // When
        SyncJob job = scheduler.submit(SyncJobKey.columnar(DAY_ONE), SyncMode.INCREMENTAL).join();

        // Then
        assertEquals(SyncJob.JobStatus.COMPLETED, job.getStatus());
        verify(columnarEngine).refresh(DAY_ONE);
        assertTrue(versionRegistry.current(definition.getId()) > dailyBefore);
        assertTrue(versionRegistry.current(monthly.getId()) > monthlyBefore);
        verify(eventPublisher).publishEvent(
                new DataRefreshedEvent(List.of(Fixtures.STORE_DAILY, Fixtures.STORE_MONTHLY), DAY_ONE));
    }

    @Test
    void testSubmit_MonthlyJobsKeyedByAlignedWindow() {
        // Given
        SyncScheduler scheduler = directScheduler();
        AggregationDefinition monthly = Fixtures.storeMonthly();
        TimeWindow month = TimeWindow.of(LocalDate.parse("2026-01-01"), LocalDate.parse("2026-01-31"));
        when(definitionRegistry.find(Fixtures.STORE_MONTHLY)).thenReturn(Optional.of(monthly));
        when(definitionRegistry.require(Fixtures.STORE_MONTHLY)).thenReturn(monthly);
        when(segmentService.rebuildWindow(monthly, month, false))
                .thenReturn(new WindowRebuildResult(monthly.getId(), month));

        // When
        SyncJob first = scheduler.submit(SyncJobKey.definition(Fixtures.STORE_MONTHLY, DAY_ONE), SyncMode.INCREMENTAL).join();
        SyncJob second = scheduler.submit(SyncJobKey.definition(Fixtures.STORE_MONTHLY,
                TimeWindow.day(LocalDate.parse("2026-01-02"))), SyncMode.INCREMENTAL).join();

        // Then
        assertEquals(SyncJobKey.definition(Fixtures.STORE_MONTHLY, month), first.getKey());
        assertEquals(first.getKey(), second.getKey());
        verify(segmentService, times(2)).rebuildWindow(monthly, month, false);
    }

    @Test
    void testOnDataMutation_UninitializedSnapshotSkipped() {
        // Given
        SyncScheduler scheduler = directScheduler();
        when(columnarEngine.isInitialized()).thenReturn(false);
        when(definitionRegistry.all()).thenReturn(List.of());

        // When
        scheduler.onDataMutation(DataMutationEvent.allDefinitions(DataMutationEvent.MutationType.IMPORT, DAY_ONE, 3));

        // Then
        verify(columnarEngine, never()).refresh(any());
        verifyNoInteractions(segmentService, consistencyService);
    }

    @Test
    void testOnDefinitionRegistered_BackfillsConfiguredDays() {
        // Given
        SyncScheduler scheduler = directScheduler();
        when(definitionRegistry.require(Fixtures.STORE_DAILY)).thenReturn(definition);
        TimeWindow backfill = TimeWindow.of(LocalDate.parse("2025-12-12"), LocalDate.parse("2026-01-10"));
        when(segmentService.rebuildWindow(definition, backfill, true))
                .thenReturn(new WindowRebuildResult(definition.getId(), backfill));

        // When
        scheduler.onDefinitionRegistered(new DefinitionRegisteredEvent(definition, false));

        // Then
        verify(segmentService).rebuildWindow(definition, backfill, true);
    }

    @Test
    void testRefreshRecordCount_CountFailureIgnored() {
        // Given
        SyncScheduler scheduler = directScheduler();
        when(factRecordRepository.countByDeletedFalse()).thenThrow(new IllegalStateException("pool exhausted"));

        // When / Then
        assertDoesNotThrow(scheduler::refreshRecordCount);
        verify(router, never()).updateRecordCount(anyLong());
    }

    @Test
    void testLookbackWindow_EndsToday() {
        // When
        TimeWindow window = directScheduler().lookbackWindow();

        // Then
        assertEquals(LocalDate.parse("2026-01-04"), window.getStart());
        assertEquals(LocalDate.parse("2026-01-10"), window.getEnd());
    }

    private SyncScheduler scheduler() {
        return new SyncScheduler(definitionRegistry, segmentService, columnarEngine, consistencyService,
                versionRegistry, router, factRecordRepository, new EngineProperties(), executor, eventPublisher, clock);
    }

    private SyncScheduler directScheduler() {
        return new SyncScheduler(definitionRegistry, segmentService, columnarEngine, consistencyService,
                versionRegistry, router, factRecordRepository, new EngineProperties(), Runnable::run, eventPublisher, clock);
    }
}
