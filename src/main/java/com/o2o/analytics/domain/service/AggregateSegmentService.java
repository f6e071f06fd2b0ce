package com.o2o.analytics.domain.service;

import com.o2o.analytics.domain.exception.SegmentRebuildFailedException;
import com.o2o.analytics.domain.model.AggregateSegment;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.FactRecord;
import com.o2o.analytics.domain.model.SegmentKey;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.model.WindowRebuildResult;
import com.o2o.analytics.infrastructure.persistence.entity.AggregateSegmentEntity;
import com.o2o.analytics.infrastructure.persistence.entity.AggregateSegmentEntity.SegmentState;
import com.o2o.analytics.infrastructure.persistence.entity.FactRecordEntity;
import com.o2o.analytics.infrastructure.persistence.repository.AggregateSegmentRepository;
import com.o2o.analytics.infrastructure.persistence.repository.FactRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Aggregate store: precomputed segments per (definition, dimension key, bucket).
 *
 * Write Path:
 * 1. Load the raw records of the key (tombstones included) outside any transaction
 * 2. Reduce them into a candidate segment
 * 3. In one transaction: lock the published row, compare, insert the candidate
 *    as SHADOW, delete the old row, promote the shadow
 *
 * Ordering:
 * - A candidate older than the published version is discarded
 * - A candidate equal to the published segment is a no-op
 * - A rebuild that is not newer than the published segment but differs from it
 *   means records left the key (moved to another date or store). The key is
 *   re-read under its lock and published at the published version, so versions
 *   never go backwards
 *
 * Failure Handling:
 * - Any error while recomputing or swapping raises SegmentRebuildFailedException
 * - The previously published segment stays in place
 *
 * Windows are widened to bucket boundaries so a bucket is always rebuilt from
 * all of its days.
 */
@Slf4j
@Service
public class AggregateSegmentService {

    private static final int LOCK_STRIPES = 64;

    private final FactRecordRepository factRecordRepository;
    private final AggregateSegmentRepository segmentRepository;
    private final AggregationEvaluator evaluator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // the row lock only exists once a segment has been published, so swaps are also striped in-process
    private final Object[] stripes = new Object[LOCK_STRIPES];

    public AggregateSegmentService(FactRecordRepository factRecordRepository,
                                   AggregateSegmentRepository segmentRepository,
                                   AggregationEvaluator evaluator,
                                   TransactionTemplate transactionTemplate,
                                   Clock clock) {
        this.factRecordRepository = factRecordRepository;
        this.segmentRepository = segmentRepository;
        this.evaluator = evaluator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    /**
     * Recomputes every bucket of {@code window} for one dimension key.
     *
     * @return the segments now published for that key in the window
     */
    public List<AggregateSegment> upsertSegment(AggregationDefinition definition, String dimensionKey, TimeWindow window) {
        TimeWindow aligned = definition.getBucket().align(window);
        Map<SegmentKey, List<FactRecord>> raw = rawGroups(definition, aligned);

        List<AggregateSegment> segments = new ArrayList<>();
        for (LocalDate bucket : buckets(definition, aligned)) {
            SegmentKey key = SegmentKey.of(dimensionKey, bucket);
            rebuild(definition, key, raw.getOrDefault(key, List.of())).ifPresent(segments::add);
        }
        return segments;
    }

    /**
     * Recomputes a single segment.
     *
     * @return the published segment, or empty when the key has no raw records and was removed
     */
    public Optional<AggregateSegment> upsertSegment(AggregationDefinition definition, SegmentKey key) {
        TimeWindow bucketWindow = definition.getBucket().windowOf(key.getBucket());
        List<FactRecord> records = rawGroups(definition, bucketWindow).getOrDefault(key, List.of());
        return rebuild(definition, key, records);
    }

    public Optional<AggregateSegment> getSegment(AggregationDefinition definition, SegmentKey key) {
        return segmentRepository.findSegment(definition.getId(), key.getDimensionKey(), key.getBucket(), SegmentState.PUBLISHED)
                .stream()
                .findFirst()
                .map(AggregateSegmentEntity::toSegment);
    }

    /**
     * Every published segment of a dimension key, all buckets.
     */
    public List<AggregateSegment> getSegments(AggregationDefinition definition, String dimensionKey) {
        return segmentRepository.findByDimensionKey(definition.getId(), dimensionKey, SegmentState.PUBLISHED)
                .stream()
                .map(AggregateSegmentEntity::toSegment)
                .collect(Collectors.toList());
    }

    public List<AggregateSegment> findPublished(AggregationDefinition definition, TimeWindow window) {
        TimeWindow aligned = definition.getBucket().align(window);
        return segmentRepository.findInWindow(definition.getId(), SegmentState.PUBLISHED, aligned.getStart(), aligned.getEnd())
                .stream()
                .map(AggregateSegmentEntity::toSegment)
                .collect(Collectors.toList());
    }

    public boolean deleteSegment(AggregationDefinition definition, SegmentKey key) {
        synchronized (stripeFor(definition.getId(), key)) {
            Boolean deleted = transactionTemplate.execute(status -> {
                List<AggregateSegmentEntity> current = segmentRepository.lockSegment(
                        definition.getId(), key.getDimensionKey(), key.getBucket(), SegmentState.PUBLISHED);
                segmentRepository.deleteAll(current);
                return !current.isEmpty();
            });
            if (Boolean.TRUE.equals(deleted)) {
                log.debug("Deleted segment {} of {}", key, definition.getId());
            }
            return Boolean.TRUE.equals(deleted);
        }
    }

    /**
     * Brings every segment of the window in line with the raw records.
     *
     * Incremental mode skips segments whose version and row count already match
     * the raw side; {@code force} recomputes all of them. Segments whose key lost
     * every raw record are deleted. Per-segment failures are collected, not thrown.
     */
    public WindowRebuildResult rebuildWindow(AggregationDefinition definition, TimeWindow window, boolean force) {
        TimeWindow aligned = definition.getBucket().align(window);
        Map<SegmentKey, List<FactRecord>> raw = rawGroups(definition, aligned);
        Map<SegmentKey, AggregateSegment> published = new LinkedHashMap<>();
        for (AggregateSegment segment : findPublished(definition, aligned)) {
            published.putIfAbsent(segment.key(), segment);
        }

        WindowRebuildResult result = new WindowRebuildResult(definition.getId(), aligned);
        Set<SegmentKey> keys = new TreeSet<>(raw.keySet());
        keys.addAll(published.keySet());

        for (SegmentKey key : keys) {
            try {
                List<FactRecord> records = raw.get(key);
                if (records == null) {
                    deleteSegment(definition, key);
                    result.recordDeleted();
                    continue;
                }
                AggregateSegment existing = published.get(key);
                if (!force && existing != null && isCurrent(existing, records)) {
                    result.recordUnchanged();
                    continue;
                }
                Optional<AggregateSegment> stored = recomputeAndPublish(definition, key, records);
                if (stored.isEmpty()) {
                    result.recordDeleted();
                } else if (stored.get().equals(existing)) {
                    result.recordUnchanged();
                } else {
                    result.recordUpserted();
                }
            } catch (RuntimeException e) {
                log.warn("Segment {} of {} not rebuilt: {}", key, definition.getId(), e.getMessage());
                result.getFailures().put(key, e.getMessage());
            }
        }

        log.info("Rebuilt {} over {}: {} upserted, {} deleted, {} unchanged, {} failed",
                definition.getId(), aligned, result.getUpserted(), result.getDeleted(),
                result.getUnchanged(), result.getFailures().size());
        return result;
    }

    /**
     * Swaps {@code candidate} in as the published segment of its key.
     *
     * @return the segment published after the call, which is the current one
     *         when the candidate was stale or identical
     */
    public AggregateSegment publish(AggregateSegment candidate) {
        SegmentKey key = candidate.key();
        synchronized (stripeFor(candidate.getDefinitionId(), key)) {
            return transactionTemplate.execute(status -> {
                List<AggregateSegmentEntity> current = segmentRepository.lockSegment(
                        candidate.getDefinitionId(), key.getDimensionKey(), key.getBucket(), SegmentState.PUBLISHED);

                if (!current.isEmpty()) {
                    AggregateSegmentEntity newest = current.get(0);
                    if (newest.getSourceVersion() > candidate.getVersion()) {
                        log.debug("Discarding segment {} of {} at version {}, published version is {}",
                                key, candidate.getDefinitionId(), candidate.getVersion(), newest.getSourceVersion());
                        return newest.toSegment();
                    }
                    if (current.size() == 1 && newest.toSegment().equals(candidate)) {
                        return newest.toSegment();
                    }
                }

                AggregateSegmentEntity shadow = segmentRepository.save(AggregateSegmentEntity.shadowOf(candidate));
                segmentRepository.deleteAll(current);
                shadow.markPublished(clock.instant());
                AggregateSegmentEntity published = segmentRepository.save(shadow);

                log.debug("Published segment {} of {} (version {}, {} rows)",
                        key, candidate.getDefinitionId(), candidate.getVersion(), candidate.getSourceRowCount());
                return published.toSegment();
            });
        }
    }

    private Optional<AggregateSegment> rebuild(AggregationDefinition definition, SegmentKey key, List<FactRecord> records) {
        if (records.isEmpty()) {
            deleteSegment(definition, key);
            return Optional.empty();
        }
        return recomputeAndPublish(definition, key, records);
    }

    private Optional<AggregateSegment> recomputeAndPublish(AggregationDefinition definition, SegmentKey key,
                                                           List<FactRecord> records) {
        try {
            return publishRebuilt(definition, key, compute(definition, key, records));
        } catch (RuntimeException e) {
            throw new SegmentRebuildFailedException(definition.getId(), key, e);
        }
    }

    private Optional<AggregateSegment> publishRebuilt(AggregationDefinition definition, SegmentKey key,
                                                      AggregateSegment candidate) {
        synchronized (stripeFor(definition.getId(), key)) {
            Optional<AggregateSegment> current = getSegment(definition, key);
            if (current.isEmpty()
                    || candidate.getVersion() > current.get().getVersion()
                    || candidate.sameContentAs(current.get())) {
                return Optional.of(publish(candidate));
            }

            AggregateSegment published = current.get();
            List<FactRecord> records = rawGroups(definition, definition.getBucket().windowOf(key.getBucket()))
                    .getOrDefault(key, List.of());
            if (records.isEmpty()) {
                deleteSegment(definition, key);
                return Optional.empty();
            }
            AggregateSegment fresh = compute(definition, key, records);
            if (fresh.sameContentAs(published)) {
                return Optional.of(published);
            }
            log.debug("Records left segment {} of {}, republishing at version {}",
                    key, definition.getId(), published.getVersion());
            fresh.setVersion(Math.max(fresh.getVersion(), published.getVersion()));
            return Optional.of(publish(fresh));
        }
    }

    AggregateSegment compute(AggregationDefinition definition, SegmentKey key, List<FactRecord> records) {
        List<FactRecord> live = records.stream().filter(r -> !r.isDeleted()).collect(Collectors.toList());
        AggregationEvaluator.ReducedValues values = evaluator.reduce(definition, live);
        return AggregateSegment.builder()
                .definitionId(definition.getId())
                .dimensionKey(key.getDimensionKey())
                .bucket(key.getBucket())
                .dimensionValues(evaluator.dimensionValues(definition, records.get(0)))
                .measures(new LinkedHashMap<>(values.getMeasures()))
                .derived(new LinkedHashMap<>(values.getDerived()))
                .sourceRowCount(live.size())
                .version(sourceVersion(records))
                .build();
    }

    /**
     * Raw records in the window that pass the definition filter, grouped by segment key.
     */
    Map<SegmentKey, List<FactRecord>> rawGroups(AggregationDefinition definition, TimeWindow window) {
        List<FactRecord> records = factRecordRepository.findInWindow(window.getStart(), window.getEnd())
                .stream()
                .map(FactRecordEntity::toRecord)
                .collect(Collectors.toList());
        return evaluator.groupBySegment(definition, evaluator.applicable(definition, records));
    }

    static long sourceVersion(List<FactRecord> records) {
        return records.stream()
                .map(FactRecord::getUpdatedAt)
                .filter(t -> t != null)
                .mapToLong(Instant::toEpochMilli)
                .max()
                .orElse(0L);
    }

    private static boolean isCurrent(AggregateSegment existing, List<FactRecord> records) {
        long live = records.stream().filter(r -> !r.isDeleted()).count();
        return existing.getVersion() >= sourceVersion(records) && existing.getSourceRowCount() == live;
    }

    private static List<LocalDate> buckets(AggregationDefinition definition, TimeWindow aligned) {
        List<LocalDate> buckets = new ArrayList<>();
        for (LocalDate bucket = aligned.getStart(); !bucket.isAfter(aligned.getEnd());
             bucket = definition.getBucket().lastDayOf(bucket).plusDays(1)) {
            buckets.add(bucket);
        }
        return buckets;
    }

    private Object stripeFor(String definitionId, SegmentKey key) {
        int hash = 31 * definitionId.hashCode() + key.hashCode();
        return stripes[Math.floorMod(hash, LOCK_STRIPES)];
    }
}
