package com.o2o.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Segment key whose repair failed and is retried on the next scheduled run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnresolvedKey {

    private String definitionId;
    private SegmentKey key;
    private String error;
    private int attempts;
    private Instant firstSeen;
    private Instant lastAttempt;
}
