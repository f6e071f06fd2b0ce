package com.o2o.analytics.infrastructure.columnar;

import com.o2o.analytics.domain.model.TimeWindow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable published snapshot plus a reference count of queries reading it.
 *
 * A generation replaced by a newer one is retired; once retired and unreferenced
 * it is closed, cannot be acquired again, and its files may be deleted unless a
 * live generation still points at them.
 */
public class SnapshotGeneration {

    private final SnapshotManifest manifest;
    private int references;
    private boolean retired;
    private boolean closed;

    public SnapshotGeneration(SnapshotManifest manifest) {
        this.manifest = manifest;
    }

    public SnapshotManifest getManifest() {
        return manifest;
    }

    public long getGeneration() {
        return manifest.getGeneration();
    }

    public synchronized boolean tryAcquire() {
        if (closed) {
            return false;
        }
        references++;
        return true;
    }

    /**
     * @return true when this call closed the generation
     */
    public synchronized boolean release() {
        references--;
        return closeIfUnused();
    }

    /**
     * @return true when this call closed the generation
     */
    public synchronized boolean retire() {
        retired = true;
        return closeIfUnused();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int references() {
        return references;
    }

    public boolean hasData() {
        return !manifest.getPartitions().isEmpty();
    }

    public boolean covers(TimeWindow window) {
        for (LocalDate date : window.dates()) {
            if (!manifest.getPartitions().containsKey(date.toString())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Relative paths of the non-empty partitions inside the window.
     */
    public List<String> filesFor(TimeWindow window) {
        List<String> files = new ArrayList<>();
        for (LocalDate date : window.dates()) {
            SnapshotManifest.PartitionFile partition = manifest.getPartitions().get(date.toString());
            if (partition != null && partition.getFile() != null) {
                files.add(partition.getFile());
            }
        }
        return files;
    }

    public Set<String> files() {
        Set<String> files = new HashSet<>();
        for (SnapshotManifest.PartitionFile partition : manifest.getPartitions().values()) {
            if (partition.getFile() != null) {
                files.add(partition.getFile());
            }
        }
        return files;
    }

    public long rowCount() {
        return manifest.getPartitions().values().stream().mapToLong(SnapshotManifest.PartitionFile::getRowCount).sum();
    }

    private boolean closeIfUnused() {
        if (retired && references == 0 && !closed) {
            closed = true;
            return true;
        }
        return false;
    }
}
