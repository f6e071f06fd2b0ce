package com.o2o.analytics.domain.service;

import com.o2o.analytics.domain.model.DataMutationEvent;
import com.o2o.analytics.domain.model.DataMutationEvent.MutationType;
import com.o2o.analytics.domain.model.FactRecord;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.infrastructure.persistence.entity.FactRecordEntity;
import com.o2o.analytics.infrastructure.persistence.repository.FactRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes raw order facts and announces the change.
 *
 * Every write stamps {@code updatedAt} with the current time so the versions of the
 * affected segments move forward. The {@link DataMutationEvent} is delivered to
 * listeners once the transaction has committed.
 */
@Slf4j
@Service
public class FactIngestionService {

    private final FactRecordRepository factRecordRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public FactIngestionService(FactRecordRepository factRecordRepository,
                                ApplicationEventPublisher eventPublisher,
                                Clock clock) {
        this.factRecordRepository = factRecordRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Inserts the records, replacing any stored record with the same id.
     *
     * @return number of records written
     */
    @Transactional
    public int importRecords(List<FactRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        for (FactRecord record : records) {
            if (record.getOrderId() == null || record.getStoreId() == null || record.getOrderDate() == null) {
                throw new IllegalArgumentException("Order id, store id and order date are required: " + record);
            }
        }

        Instant now = clock.instant();
        Map<UUID, FactRecordEntity> stored = factRecordRepository.findAllById(recordIds(records)).stream()
                .collect(Collectors.toMap(FactRecordEntity::getRecordId, Function.identity()));

        // a replaced line may have moved to another date, both dates need rebuilding
        List<LocalDate> touchedDates = new ArrayList<>();
        List<FactRecordEntity> entities = new ArrayList<>(records.size());
        int replaced = 0;
        for (FactRecord record : records) {
            FactRecord stamped = record.toBuilder().deleted(false).updatedAt(now).build();
            touchedDates.add(stamped.getOrderDate());
            FactRecordEntity existing = stamped.getRecordId() == null
                    ? null : stored.get(UUID.fromString(stamped.getRecordId()));
            if (existing == null) {
                entities.add(FactRecordEntity.from(stamped));
            } else {
                touchedDates.add(existing.getOrderDate());
                existing.replaceWith(stamped);
                entities.add(existing);
                replaced++;
            }
        }
        factRecordRepository.saveAll(entities);

        TimeWindow window = windowOf(touchedDates);
        log.info("Imported {} fact records ({} replaced) over {}", records.size(), replaced, window);
        eventPublisher.publishEvent(DataMutationEvent.allDefinitions(MutationType.IMPORT, window, records.size()));
        return records.size();
    }

    /**
     * Logically deletes every live record of the given orders.
     *
     * @return number of records deleted
     */
    @Transactional
    public int deleteOrders(Collection<String> orderIds) {
        if (orderIds.isEmpty()) {
            return 0;
        }
        List<FactRecordEntity> live = factRecordRepository.findByOrderIdInAndDeletedFalse(orderIds);
        if (live.isEmpty()) {
            log.debug("No live records for orders {}", orderIds);
            return 0;
        }

        Instant now = clock.instant();
        live.forEach(entity -> entity.markDeleted(now));
        factRecordRepository.saveAll(live);

        TimeWindow window = windowOf(live.stream().map(FactRecordEntity::getOrderDate).collect(Collectors.toList()));
        log.info("Deleted {} fact records of {} orders over {}", live.size(), orderIds.size(), window);
        eventPublisher.publishEvent(DataMutationEvent.allDefinitions(MutationType.DELETE, window, live.size()));
        return live.size();
    }

    private static List<UUID> recordIds(List<FactRecord> records) {
        return records.stream()
                .map(FactRecord::getRecordId)
                .filter(Objects::nonNull)
                .map(UUID::fromString)
                .collect(Collectors.toList());
    }

    private static TimeWindow windowOf(List<LocalDate> dates) {
        LocalDate first = dates.stream().min(Comparator.naturalOrder()).orElseThrow();
        LocalDate last = dates.stream().max(Comparator.naturalOrder()).orElseThrow();
        return TimeWindow.of(first, last);
    }
}
