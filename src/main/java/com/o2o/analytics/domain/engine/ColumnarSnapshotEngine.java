package com.o2o.analytics.domain.engine;

import com.o2o.analytics.config.EngineProperties;
import com.o2o.analytics.domain.exception.EngineUnavailableException;
import com.o2o.analytics.domain.model.AggregationDefinition;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.FactRecord;
import com.o2o.analytics.domain.model.ResultRow;
import com.o2o.analytics.domain.model.ResultSet;
import com.o2o.analytics.domain.model.TimeWindow;
import com.o2o.analytics.domain.service.AggregationEvaluator;
import com.o2o.analytics.infrastructure.columnar.ParquetPartitionStore;
import com.o2o.analytics.infrastructure.columnar.SnapshotGeneration;
import com.o2o.analytics.infrastructure.columnar.SnapshotManifest;
import com.o2o.analytics.infrastructure.columnar.SnapshotManifest.PartitionFile;
import com.o2o.analytics.infrastructure.persistence.entity.FactRecordEntity;
import com.o2o.analytics.infrastructure.persistence.repository.FactRecordRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Columnar snapshot of the live fact table, one Parquet file per day.
 *
 * Layout:
 * <pre>
 * {dataDir}/manifest.json
 * {dataDir}/gen-{n}/orders_{yyyyMMdd}.parquet
 * </pre>
 *
 * Refresh Flow:
 * 1. Export live records of each day in the window to files under a new generation directory
 * 2. Merge them with the partitions of the current generation
 * 3. Write the manifest (temp file + atomic move)
 * 4. Swap the in-memory generation reference
 *
 * Readers acquire the generation they start on and release it when done, so
 * a refresh never blocks or breaks a running query. Files are deleted only
 * after every generation pointing at them has been retired and released.
 *
 * Aggregation happens in the JVM with the same evaluator as the aggregate
 * store; DuckDB handles file scanning with date and dimension pushdown.
 */
@Slf4j
@Component
public class ColumnarSnapshotEngine implements QueryEngine {

    private static final String MANIFEST_FILE = "manifest.json";
    private static final String GENERATION_PREFIX = "gen-";
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final FactRecordRepository factRecordRepository;
    private final ParquetPartitionStore partitionStore;
    private final AggregationEvaluator evaluator;
    private final EngineProperties.ColumnarProperties properties;
    private final Clock clock;
    private final Path dataDir;

    private final AtomicReference<SnapshotGeneration> current =
            new AtomicReference<>(new SnapshotGeneration(SnapshotManifest.empty()));
    private final List<SnapshotGeneration> retired = new CopyOnWriteArrayList<>();
    private final Object refreshLock = new Object();
    private final Object purgeLock = new Object();

    private volatile boolean initialized;

    public ColumnarSnapshotEngine(FactRecordRepository factRecordRepository,
                                  ParquetPartitionStore partitionStore,
                                  AggregationEvaluator evaluator,
                                  EngineProperties engineProperties,
                                  Clock clock) {
        this.factRecordRepository = factRecordRepository;
        this.partitionStore = partitionStore;
        this.evaluator = evaluator;
        this.properties = engineProperties.getColumnar();
        this.clock = clock;
        this.dataDir = Paths.get(properties.getDataDir());
    }

    /**
     * Loads the last published manifest so a restart keeps serving the existing snapshot.
     */
    @PostConstruct
    public void initialize() {
        if (!properties.isEnabled()) {
            log.info("Columnar snapshot disabled");
            return;
        }
        if (!partitionStore.driverAvailable()) {
            log.warn("Columnar snapshot unavailable: DuckDB driver missing");
            return;
        }
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            log.warn("Columnar snapshot unavailable: cannot create {}: {}", dataDir, e.getMessage());
            return;
        }

        SnapshotManifest manifest = partitionStore.readManifest(dataDir.resolve(MANIFEST_FILE))
                .map(this::withoutMissingFiles)
                .orElseGet(SnapshotManifest::empty);
        current.set(new SnapshotGeneration(manifest));
        sweepUnreferencedFiles();
        initialized = true;

        log.info("Columnar snapshot ready: generation {}, {} partitions, {} rows",
                manifest.getGeneration(), manifest.getPartitions().size(), current.get().rowCount());
    }

    @Override
    public EngineType type() {
        return EngineType.COLUMNAR_SNAPSHOT;
    }

    @Override
    public boolean available() {
        return initialized && current.get().hasData();
    }

    @Override
    public boolean available(TimeWindow window) {
        return initialized && current.get().covers(window);
    }

    @Override
    public ResultSet query(AggregationDefinition definition, Map<String, String> filters, TimeWindow window) {
        if (!initialized) {
            throw new EngineUnavailableException(type(), "Columnar snapshot not initialized");
        }
        SnapshotGeneration generation = acquire();
        try {
            if (!generation.covers(window)) {
                throw new EngineUnavailableException(type(),
                        "Snapshot generation " + generation.getGeneration() + " does not cover " + window);
            }
            List<Path> files = generation.filesFor(window).stream()
                    .map(dataDir::resolve)
                    .collect(Collectors.toList());
            List<FactRecord> records = partitionStore.read(files, window, filters);
            List<ResultRow> rows = evaluator.aggregate(definition, records);

            log.debug("Columnar snapshot returned {} rows for {} over {} (generation {}, {} files)",
                    rows.size(), definition.getId(), window, generation.getGeneration(), files.size());
            return ResultSet.builder()
                    .definitionId(definition.getId())
                    .window(window)
                    .rows(rows)
                    .build();
        } finally {
            if (generation.release()) {
                purgeRetired();
            }
        }
    }

    /**
     * Re-exports every day of {@code window} and publishes a new generation.
     *
     * @return the published manifest
     */
    public SnapshotManifest refresh(TimeWindow window) {
        if (!initialized) {
            throw new EngineUnavailableException(type(), "Columnar snapshot not initialized");
        }
        synchronized (refreshLock) {
            SnapshotGeneration previous = current.get();
            long generation = previous.getGeneration() + 1;
            Path generationDir = dataDir.resolve(GENERATION_PREFIX + generation);

            Map<LocalDate, List<FactRecord>> byDate = factRecordRepository
                    .findLiveInWindow(window.getStart(), window.getEnd())
                    .stream()
                    .map(FactRecordEntity::toRecord)
                    .collect(Collectors.groupingBy(FactRecord::getOrderDate, TreeMap::new, Collectors.toList()));

            Map<String, PartitionFile> partitions = new TreeMap<>(previous.getManifest().getPartitions());
            long exported = 0;
            try {
                for (LocalDate date : window.dates()) {
                    List<FactRecord> rows = byDate.getOrDefault(date, List.of());
                    if (rows.isEmpty()) {
                        partitions.put(date.toString(), PartitionFile.empty());
                        continue;
                    }
                    Path file = generationDir.resolve("orders_" + FILE_DATE.format(date) + ".parquet");
                    partitionStore.writePartition(file, rows);
                    partitions.put(date.toString(), new PartitionFile(dataDir.relativize(file).toString(), rows.size()));
                    exported += rows.size();
                }
                SnapshotManifest manifest = new SnapshotManifest(generation, clock.instant(), partitions);
                partitionStore.writeManifest(dataDir.resolve(MANIFEST_FILE), manifest);

                current.set(new SnapshotGeneration(manifest));
                retired.add(previous);
                if (previous.retire()) {
                    purgeRetired();
                }
                log.info("Published columnar generation {} for {} ({} rows exported)", generation, window, exported);
                return manifest;
            } catch (RuntimeException e) {
                deleteDirectory(generationDir);
                throw e;
            }
        }
    }

    public long generation() {
        return current.get().getGeneration();
    }

    public long rowCount() {
        return current.get().rowCount();
    }

    public boolean isInitialized() {
        return initialized;
    }

    private SnapshotGeneration acquire() {
        while (true) {
            SnapshotGeneration generation = current.get();
            if (generation.tryAcquire()) {
                return generation;
            }
        }
    }

    /**
     * Deletes files of closed generations that no open generation references.
     */
    void purgeRetired() {
        synchronized (purgeLock) {
            Set<String> referenced = new HashSet<>(current.get().files());
            List<SnapshotGeneration> closed = new ArrayList<>();
            for (SnapshotGeneration generation : retired) {
                if (generation.isClosed()) {
                    closed.add(generation);
                } else {
                    referenced.addAll(generation.files());
                }
            }
            for (SnapshotGeneration generation : closed) {
                for (String file : generation.files()) {
                    if (!referenced.contains(file)) {
                        deleteQuietly(dataDir.resolve(file));
                    }
                }
                retired.remove(generation);
            }
            deleteEmptyGenerationDirs();
        }
    }

    private SnapshotManifest withoutMissingFiles(SnapshotManifest manifest) {
        Map<String, PartitionFile> partitions = new TreeMap<>();
        manifest.getPartitions().forEach((date, partition) -> {
            if (partition.getFile() == null || Files.exists(dataDir.resolve(partition.getFile()))) {
                partitions.put(date, partition);
            } else {
                log.warn("Snapshot partition {} missing file {}, dropped", date, partition.getFile());
            }
        });
        return new SnapshotManifest(manifest.getGeneration(), manifest.getPublishedAt(), partitions);
    }

    /**
     * Removes leftovers of refreshes interrupted before their manifest was written.
     */
    private void sweepUnreferencedFiles() {
        Set<Path> referenced = current.get().files().stream()
                .map(f -> dataDir.resolve(f).normalize())
                .collect(Collectors.toSet());
        for (Path dir : generationDirs()) {
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(f -> !referenced.contains(f.normalize())).forEach(this::deleteQuietly);
            } catch (IOException e) {
                log.warn("Cannot sweep {}: {}", dir, e.getMessage());
            }
        }
        deleteEmptyGenerationDirs();
    }

    /**
     * Only directories older than the current generation; a newer one may be mid-refresh.
     */
    private void deleteEmptyGenerationDirs() {
        long currentGeneration = current.get().getGeneration();
        for (Path dir : generationDirs()) {
            if (generationNumber(dir) >= currentGeneration) {
                continue;
            }
            try (Stream<Path> files = Files.list(dir)) {
                if (files.findAny().isEmpty()) {
                    Files.deleteIfExists(dir);
                }
            } catch (IOException e) {
                log.warn("Cannot remove {}: {}", dir, e.getMessage());
            }
        }
    }

    private List<Path> generationDirs() {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dataDir)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().startsWith(GENERATION_PREFIX))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static long generationNumber(Path dir) {
        try {
            return Long.parseLong(dir.getFileName().toString().substring(GENERATION_PREFIX.length()));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
        } catch (IOException e) {
            log.warn("Cannot clean up {}: {}", dir, e.getMessage());
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Cannot delete {}: {}", path, e.getMessage());
        }
    }
}
