package com.o2o.analytics.infrastructure.columnar;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * On-disk description of a snapshot generation, stored as {@code manifest.json}.
 *
 * Partitions are keyed by ISO date. A partition without a file covers a day
 * that had no live records when it was exported.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotManifest {

    private long generation;
    private Instant publishedAt;
    private Map<String, PartitionFile> partitions = new TreeMap<>();

    public static SnapshotManifest empty() {
        return new SnapshotManifest(0L, null, new TreeMap<>());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartitionFile {

        /**
         * Path relative to the data directory; null for an empty day.
         */
        private String file;
        private long rowCount;

        public static PartitionFile empty() {
            return new PartitionFile(null, 0L);
        }
    }
}
