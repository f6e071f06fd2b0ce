package com.o2o.analytics.domain.service;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.model.AggregateSegment;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.ConsistencyReport;
import com.o2o.analytics.domain.model.FactRecord;
import com.o2o.analytics.domain.model.KeyMismatch;
import com.o2o.analytics.domain.model.RepairResult;
import com.o2o.analytics.domain.model.SegmentKey;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.model.UnresolvedKey;
import com.o2o.analytics.infrastructure.persistence.entity.FactRecordEntity;
import com.o2o.analytics.infrastructure.persistence.repository.FactRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Compares raw records with published segments and repairs the drift.
 *
 * Classification per key:
 * - missing: raw records exist, no published segment
 * - orphan: published segment, no raw record at all
 * - mismatched: both exist and the live row count or the primary measure
 *   differs by more than the configured tolerance
 *
 * Repair rebuilds missing and mismatched keys and deletes orphans, one key at a
 * time. A key that fails stays unresolved until a later run repairs it.
 */
@Slf4j
@Service
public class ConsistencyService {

    private final FactRecordRepository factRecordRepository;
    private final AggregateSegmentService segmentService;
    private final AggregationEvaluator evaluator;
    private final DataVersionRegistry versionRegistry;
    private final DefinitionRegistry definitionRegistry;
    private final EngineProperties.ConsistencyProperties properties;
    private final List<ConsistencyExclusionFilter> exclusionFilters;
    private final Clock clock;

    private final Map<String, Map<SegmentKey, UnresolvedKey>> unresolved = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastCheck = new AtomicReference<>();

    public ConsistencyService(FactRecordRepository factRecordRepository,
                              AggregateSegmentService segmentService,
                              AggregationEvaluator evaluator,
                              DataVersionRegistry versionRegistry,
                              DefinitionRegistry definitionRegistry,
                              EngineProperties engineProperties,
                              List<ConsistencyExclusionFilter> exclusionFilters,
                              Clock clock) {
        this.factRecordRepository = factRecordRepository;
        this.segmentService = segmentService;
        this.evaluator = evaluator;
        this.versionRegistry = versionRegistry;
        this.definitionRegistry = definitionRegistry;
        this.properties = engineProperties.getConsistency();
        this.exclusionFilters = exclusionFilters;
        this.clock = clock;
    }

    public ConsistencyReport check(AggregationDefinition definition, TimeWindow window) {
        TimeWindow aligned = definition.getBucket().align(window);
        List<FactRecord> records = factRecordRepository.findInWindow(aligned.getStart(), aligned.getEnd())
                .stream()
                .map(FactRecordEntity::toRecord)
                .collect(Collectors.toList());
        Map<SegmentKey, List<FactRecord>> raw =
                evaluator.groupBySegment(definition, evaluator.applicable(definition, records));

        Map<SegmentKey, AggregateSegment> aggregate = new TreeMap<>();
        for (AggregateSegment segment : segmentService.findPublished(definition, aligned)) {
            aggregate.putIfAbsent(segment.key(), segment);
        }

        ConsistencyReport report = ConsistencyReport.builder()
                .definitionId(definition.getId())
                .window(aligned)
                .checkedAt(clock.instant())
                .build();

        Set<SegmentKey> keys = new TreeSet<>(raw.keySet());
        keys.addAll(aggregate.keySet());
        String primary = definition.primaryMeasureName();
        int checked = 0;
        int excluded = 0;

        for (SegmentKey key : keys) {
            List<FactRecord> rawRecords = raw.get(key);
            AggregateSegment segment = aggregate.get(key);
            Map<String, String> dimensions = rawRecords != null
                    ? evaluator.dimensionValues(definition, rawRecords.get(0))
                    : segment.getDimensionValues();
            if (isExcluded(definition, key, dimensions)) {
                excluded++;
                continue;
            }
            checked++;

            if (segment == null) {
                report.getMissingKeys().add(key);
            } else if (rawRecords == null) {
                report.getOrphanKeys().add(key);
            } else {
                List<FactRecord> live = rawRecords.stream().filter(r -> !r.isDeleted()).collect(Collectors.toList());
                double rawPrimary = evaluator.reduceMeasure(definition, primary, live);
                double aggregatePrimary = segment.getMeasures().getOrDefault(primary, 0.0);
                double delta = Math.max(
                        relativeDelta(live.size(), segment.getSourceRowCount()),
                        relativeDelta(rawPrimary, aggregatePrimary));
                if (delta > properties.getTolerance()) {
                    report.getMismatchedKeys().add(key);
                    report.getMismatchDetails().put(key, new KeyMismatch(
                            live.size(), segment.getSourceRowCount(), rawPrimary, aggregatePrimary, delta * 100.0));
                }
            }
        }

        report.setCheckedKeys(checked);
        report.setExcludedKeys(excluded);
        lastCheck.set(report.getCheckedAt());

        if (report.isConsistent()) {
            log.debug("{} consistent over {} ({} keys)", definition.getId(), aligned, checked);
        } else {
            log.warn("{} drift over {}: {} missing, {} orphan, {} mismatched",
                    definition.getId(), aligned, report.getMissingKeys().size(),
                    report.getOrphanKeys().size(), report.getMismatchedKeys().size());
        }
        return report;
    }

    public RepairResult repair(AggregationDefinition definition, ConsistencyReport report) {
        RepairResult result = RepairResult.builder()
                .definitionId(definition.getId())
                .report(report)
                .build();

        Set<SegmentKey> rebuild = new TreeSet<>(report.getMissingKeys());
        rebuild.addAll(report.getMismatchedKeys());
        for (SegmentKey key : rebuild) {
            rebuildKey(definition, key, result);
        }
        for (SegmentKey key : report.getOrphanKeys()) {
            deleteKey(definition, key, result);
        }

        finish(definition, result);
        return result;
    }

    public RepairResult checkAndRepair(AggregationDefinition definition, TimeWindow window) {
        return repair(definition, check(definition, window));
    }

    /**
     * Retries every unresolved key of the definition, whatever its bucket.
     */
    public RepairResult retryUnresolved(AggregationDefinition definition) {
        RepairResult result = RepairResult.builder().definitionId(definition.getId()).build();
        Map<SegmentKey, UnresolvedKey> pending = unresolved.get(definition.getId());
        if (pending == null || pending.isEmpty()) {
            return result;
        }
        log.info("Retrying {} unresolved keys of {}", pending.size(), definition.getId());
        for (SegmentKey key : new ArrayList<>(pending.keySet())) {
            rebuildKey(definition, key, result);
        }
        finish(definition, result);
        return result;
    }

    /**
     * Check and repair of every registered definition over {@code window}, after
     * retrying the keys earlier runs could not repair.
     */
    public List<RepairResult> checkAndRepairAll(TimeWindow window) {
        List<RepairResult> results = new ArrayList<>();
        for (AggregationDefinition definition : definitionRegistry.all()) {
            try {
                retryUnresolved(definition);
                results.add(checkAndRepair(definition, window));
            } catch (RuntimeException e) {
                log.error("Consistency pass failed for {} over {}: {}", definition.getId(), window, e.getMessage(), e);
            }
        }
        long drift = results.stream().mapToLong(r -> r.getReport().driftCount()).sum();
        log.info("Consistency pass over {}: {} definitions, {} drifted keys", window, results.size(), drift);
        return results;
    }

    public Map<String, List<UnresolvedKey>> unresolved() {
        Map<String, List<UnresolvedKey>> snapshot = new TreeMap<>();
        unresolved.forEach((definitionId, keys) -> {
            if (!keys.isEmpty()) {
                snapshot.put(definitionId, new ArrayList<>(new TreeMap<>(keys).values()));
            }
        });
        return Collections.unmodifiableMap(snapshot);
    }

    public Optional<Instant> lastCheck() {
        return Optional.ofNullable(lastCheck.get());
    }

    static double relativeDelta(double a, double b) {
        if (a == b) {
            return 0.0;
        }
        double scale = Math.max(Math.abs(a), Math.abs(b));
        return Math.abs(a - b) / scale;
    }

    private void rebuildKey(AggregationDefinition definition, SegmentKey key, RepairResult result) {
        try {
            if (segmentService.upsertSegment(definition, key).isPresent()) {
                result.getRepairedKeys().add(key);
            } else {
                result.getDeletedKeys().add(key);
            }
            resolved(definition, key);
        } catch (RuntimeException e) {
            markUnresolved(definition, key, e, result);
        }
    }

    private void deleteKey(AggregationDefinition definition, SegmentKey key, RepairResult result) {
        try {
            if (segmentService.deleteSegment(definition, key)) {
                result.getDeletedKeys().add(key);
            }
            resolved(definition, key);
        } catch (RuntimeException e) {
            markUnresolved(definition, key, e, result);
        }
    }

    private void finish(AggregationDefinition definition, RepairResult result) {
        if (result.changedAnything()) {
            long version = versionRegistry.bump(definition.getId());
            log.info("Repaired {}: {} rebuilt, {} deleted, {} unresolved (data version {})",
                    definition.getId(), result.getRepairedKeys().size(), result.getDeletedKeys().size(),
                    result.getUnresolvedKeys().size(), version);
        }
    }

    private void resolved(AggregationDefinition definition, SegmentKey key) {
        Map<SegmentKey, UnresolvedKey> pending = unresolved.get(definition.getId());
        if (pending != null && pending.remove(key) != null) {
            log.info("Unresolved key {} of {} repaired", key, definition.getId());
        }
    }

    private void markUnresolved(AggregationDefinition definition, SegmentKey key, RuntimeException e, RepairResult result) {
        String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        Instant now = clock.instant();
        result.getUnresolvedKeys().put(key, error);
        unresolved.computeIfAbsent(definition.getId(), id -> new ConcurrentHashMap<>())
                .compute(key, (k, existing) -> UnresolvedKey.builder()
                        .definitionId(definition.getId())
                        .key(key)
                        .error(error)
                        .attempts(existing == null ? 1 : existing.getAttempts() + 1)
                        .firstSeen(existing == null ? now : existing.getFirstSeen())
                        .lastAttempt(now)
                        .build());
        log.warn("Repair of {} for {} failed: {}", key, definition.getId(), error);
    }

    private boolean isExcluded(AggregationDefinition definition, SegmentKey key, Map<String, String> dimensions) {
        for (ConsistencyExclusionFilter filter : exclusionFilters) {
            if (filter.excludes(definition, key, dimensions)) {
                return true;
            }
        }
        return false;
    }
}
