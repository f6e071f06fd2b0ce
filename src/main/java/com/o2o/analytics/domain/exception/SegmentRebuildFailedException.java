package com.o2o.analytics.domain.exception;

import com.o2o.analytics.domain.model.SegmentKey;
import lombok.Getter;

/**
 * Recomputing one segment failed. The previously published segment is kept.
 */
@Getter
public class SegmentRebuildFailedException extends EngineException {

    private final String definitionId;
    private final SegmentKey key;

    public SegmentRebuildFailedException(String definitionId, SegmentKey key, Throwable cause) {
        super(ErrorCodes.SEGMENT_REBUILD_FAILED,
                "Failed to rebuild segment " + key + " of " + definitionId + ": " + cause.getMessage(), cause);
        this.definitionId = definitionId;
        this.key = key;
    }
}
