package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One run of a rebuild or snapshot refresh. Kept in memory for status reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncJob {

    @Builder.Default
    private UUID jobId = UUID.randomUUID();

    private SyncJobKey key;
    private SyncMode mode;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private String errorMessage;

    @Builder.Default
    private Instant createdAt = Instant.now();

    private Instant startedAt;
    private Instant completedAt;

    private int upserted;
    private int deleted;
    private int unchanged;
    private int failedSegments;

    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    public void markStarted() {
        this.status = JobStatus.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markCompleted() {
        this.status = JobStatus.COMPLETED;
        this.completedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = JobStatus.FAILED;
        this.errorMessage = error;
        this.completedAt = Instant.now();
    }

    public void apply(WindowRebuildResult result) {
        this.upserted = result.getUpserted();
        this.deleted = result.getDeleted();
        this.unchanged = result.getUnchanged();
        this.failedSegments = result.getFailures().size();
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
