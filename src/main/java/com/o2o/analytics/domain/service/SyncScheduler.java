package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.engine.ColumnarSnapshotEngine;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.DataMutationEvent;
import com.o2o.analytics.domain.model.DataRefreshedEvent;
import com.o2o.analytics.domain.model.DefinitionRegisteredEvent;
import com.o2o.analytics.domain.model.SyncJob;
import com.o2o.analytics.domain.model.SyncJobKey;
import com.o2o.analytics.domain.model.SyncMode;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.model.WindowRebuildResult;
import com.o2o.analytics.infrastructure.persistence.repository.FactRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Keeps segments and the columnar snapshot in line with the raw records.
 *
 * Triggers:
 * 1. Nightly: FULL rebuild of yesterday and a snapshot refresh of yesterday
 * 2. Hourly: INCREMENTAL rebuild and snapshot refresh of today, retry of failed jobs
 * 3. Periodic consistency pass over the lookback window
 * 4. Periodic record count refresh feeding the router
 * 5. Data mutations (after commit) and newly registered definitions
 *
 * Job Ordering:
 * - Jobs are keyed by (target, window); jobs with the same key are chained
 *   so they run one after another in submission order
 * - Definition windows are aligned to the definition's buckets before keying
 * - Different keys run in parallel on the sync executor
 * - A failed job is kept for the next hourly slot and never blocks other jobs
 *
 * Data Versions:
 * - A definition job that changed segments bumps that definition's version
 * - A snapshot refresh bumps every definition's version once the new generation
 *   is published, since any definition may be served from the snapshot
 */
@Slf4j
@Service
public class SyncScheduler {

    private final DefinitionRegistry definitionRegistry;
    private final AggregateSegmentService segmentService;
    private final ColumnarSnapshotEngine columnarEngine;
    private final ConsistencyService consistencyService;
    private final DataVersionRegistry versionRegistry;
    private final QueryRouter router;
    private final FactRecordRepository factRecordRepository;
    private final EngineProperties properties;
    private final Executor syncExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<SyncJobKey, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Map<SyncJobKey, SyncJob> failedJobs = new ConcurrentHashMap<>();
    private final Deque<SyncJob> recentJobs = new ConcurrentLinkedDeque<>();

    public SyncScheduler(DefinitionRegistry definitionRegistry,
                         AggregateSegmentService segmentService,
                         ColumnarSnapshotEngine columnarEngine,
                         ConsistencyService consistencyService,
                         DataVersionRegistry versionRegistry,
                         QueryRouter router,
                         FactRecordRepository factRecordRepository,
                         EngineProperties properties,
                         @Qualifier("syncExecutor") Executor syncExecutor,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock) {
        this.definitionRegistry = definitionRegistry;
        this.segmentService = segmentService;
        this.columnarEngine = columnarEngine;
        this.consistencyService = consistencyService;
        this.versionRegistry = versionRegistry;
        this.router = router;
        this.factRecordRepository = factRecordRepository;
        this.properties = properties;
        this.syncExecutor = syncExecutor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Scheduled(cron = "${o2o.engine.sync.nightly-cron:0 0 2 * * *}")
    public void nightlyRebuild() {
        TimeWindow yesterday = TimeWindow.day(today().minusDays(1));
        log.info("Nightly rebuild of {}", yesterday);
        submitAll(yesterday, SyncMode.FULL);
    }

    @Scheduled(cron = "${o2o.engine.sync.hourly-cron:0 0 * * * *}")
    public void hourlyRebuild() {
        retryFailedJobs();
        submitAll(TimeWindow.day(today()), SyncMode.INCREMENTAL);
    }

    @Scheduled(fixedDelayString = "#{@engineProperties.consistency.interval.toMillis()}",
            initialDelayString = "#{@engineProperties.consistency.interval.toMillis()}")
    public void scheduledConsistencyPass() {
        consistencyService.checkAndRepairAll(lookbackWindow());
    }

    @Scheduled(fixedDelayString = "#{@engineProperties.sync.recordCountInterval.toMillis()}")
    public void refreshRecordCount() {
        try {
            router.updateRecordCount(factRecordRepository.countByDeletedFalse());
        } catch (RuntimeException e) {
            log.warn("Record count refresh failed: {}", e.getMessage());
        }
    }

    /**
     * Rebuilds the affected definitions and the snapshot for the mutated window,
     * then checks them. Runs once the importing transaction has committed.
     */
    @TransactionalEventListener(fallbackExecution = true)
    public void onDataMutation(DataMutationEvent event) {
        log.info("{} of {} rows over {}, syncing", event.getType(), event.getAffectedRows(), event.getWindow());

        List<AggregationDefinition> affected = definitionRegistry.all().stream()
                .filter(definition -> event.affects(definition.getId()))
                .collect(Collectors.toList());

        List<CompletableFuture<SyncJob>> jobs = new ArrayList<>();
        if (columnarEngine.isInitialized()) {
            jobs.add(submit(SyncJobKey.columnar(event.getWindow()), SyncMode.INCREMENTAL));
        }
        for (AggregationDefinition definition : affected) {
            jobs.add(submit(SyncJobKey.definition(definition, event.getWindow()), SyncMode.INCREMENTAL));
        }
        CompletableFuture.allOf(jobs.toArray(new CompletableFuture[0])).join();

        // off the committing thread so repairs open their own transactions
        CompletableFuture.runAsync(() -> {
            for (AggregationDefinition definition : affected) {
                consistencyService.checkAndRepair(definition, event.getWindow());
            }
        }, syncExecutor).join();

        refreshRecordCount();
    }

    @EventListener
    public void onDefinitionRegistered(DefinitionRegisteredEvent event) {
        AggregationDefinition definition = event.getDefinition();
        LocalDate today = today();
        TimeWindow backfill = TimeWindow.of(today.minusDays(properties.getSync().getBackfillDays() - 1L), today);
        log.info("Definition {} {}, backfilling {}", definition.getId(), event.isReplaced() ? "replaced" : "registered", backfill);
        submit(SyncJobKey.definition(definition, backfill), SyncMode.FULL);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        refreshRecordCount();
        log.info("O2O analytics engine ready: tier={}, records={}, switch threshold={}, {} records until columnar, "
                        + "{} definitions, columnar generation {}",
                router.currentTier(), router.recordCount(), router.switchThreshold(), router.recordsUntilSwitch(),
                definitionRegistry.all().size(), columnarEngine.generation());
        CompletableFuture.runAsync(this::scheduledConsistencyPass, syncExecutor)
                .exceptionally(e -> {
                    log.error("Startup consistency pass failed: {}", e.getMessage(), e);
                    return null;
                });
    }

    /**
     * Queues a job behind any earlier job with the same key.
     *
     * @return completes with the finished job, failed or not
     */
    public CompletableFuture<SyncJob> submit(SyncJobKey requested, SyncMode mode) {
        SyncJobKey key = aligned(requested);
        SyncJob job = SyncJob.builder()
                .key(key)
                .mode(mode)
                .createdAt(clock.instant())
                .build();
        CompletableFuture<SyncJob> done = new CompletableFuture<>();

        CompletableFuture<Void> next = tails.compute(key, (k, tail) -> {
            CompletableFuture<Void> previous = tail == null
                    ? CompletableFuture.completedFuture(null)
                    : tail.handle((ignored, error) -> null);
            return previous.thenRunAsync(() -> done.complete(runJob(job)), syncExecutor);
        });
        next.whenComplete((ignored, error) -> {
            tails.remove(key, next);
            if (error != null && !done.isDone()) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.error("Sync job {} for {} could not run: {}", job.getJobId(), key, cause.getMessage(), cause);
                job.markFailed(cause.getMessage());
                record(job);
                done.complete(job);
            }
        });

        log.debug("Sync job {} queued for {} ({})", job.getJobId(), key, mode);
        return done;
    }

    /**
     * Resubmits every failed job in its original mode.
     */
    public int retryFailedJobs() {
        List<SyncJob> failed = new ArrayList<>(failedJobs.values());
        for (SyncJob job : failed) {
            if (failedJobs.remove(job.getKey(), job)) {
                log.info("Retrying failed job {} for {}", job.getJobId(), job.getKey());
                submit(job.getKey(), job.getMode());
            }
        }
        return failed.size();
    }

    public List<SyncJob> failedJobs() {
        return failedJobs.values().stream()
                .sorted(Comparator.comparing(SyncJob::getCreatedAt))
                .collect(Collectors.toList());
    }

    public List<SyncJob> recentJobs() {
        return new ArrayList<>(recentJobs);
    }

    public TimeWindow lookbackWindow() {
        LocalDate today = today();
        return TimeWindow.of(today.minusDays(properties.getConsistency().getLookbackDays() - 1L), today);
    }

    SyncJob runJob(SyncJob job) {
        SyncJobKey key = job.getKey();
        job.markStarted();
        log.info("Sync job {} started: {} ({})", job.getJobId(), key, job.getMode());

        try {
            if (key.isColumnar()) {
                columnarEngine.refresh(key.getWindow());
                List<String> refreshed = new ArrayList<>();
                for (AggregationDefinition definition : definitionRegistry.all()) {
                    versionRegistry.bump(definition.getId());
                    refreshed.add(definition.getId());
                }
                eventPublisher.publishEvent(new DataRefreshedEvent(refreshed, key.getWindow()));
            } else {
                AggregationDefinition definition = definitionRegistry.require(key.getTarget());
                WindowRebuildResult result =
                        segmentService.rebuildWindow(definition, key.getWindow(), job.getMode() == SyncMode.FULL);
                job.apply(result);
                if (result.changedAnything()) {
                    versionRegistry.bump(definition.getId());
                    eventPublisher.publishEvent(new DataRefreshedEvent(List.of(definition.getId()), key.getWindow()));
                }
                if (result.hasFailures()) {
                    throw new IllegalStateException(result.getFailures().size() + " segments failed to rebuild: "
                            + result.getFailures().keySet());
                }
            }
            job.markCompleted();
            failedJobs.remove(key);
            log.info("Sync job {} completed: {} ({} ms)", job.getJobId(), key, job.getExecutionTimeMs());
        } catch (RuntimeException e) {
            log.error("Sync job {} failed: {}: {}", job.getJobId(), key, e.getMessage(), e);
            job.markFailed(e.getMessage());
            failedJobs.put(key, job);
        }

        record(job);
        return job;
    }

    private void submitAll(TimeWindow window, SyncMode mode) {
        if (columnarEngine.isInitialized()) {
            submit(SyncJobKey.columnar(window), mode);
        }
        for (AggregationDefinition definition : definitionRegistry.all()) {
            submit(SyncJobKey.definition(definition, window), mode);
        }
    }

    private SyncJobKey aligned(SyncJobKey key) {
        if (key.isColumnar()) {
            return key;
        }
        return definitionRegistry.find(key.getTarget())
                .map(definition -> SyncJobKey.definition(definition, key.getWindow()))
                .orElse(key);
    }

    private void record(SyncJob job) {
        recentJobs.addFirst(job);
        while (recentJobs.size() > properties.getSync().getJobHistorySize()) {
            recentJobs.pollLast();
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
