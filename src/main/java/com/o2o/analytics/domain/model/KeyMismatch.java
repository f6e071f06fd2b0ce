package com.o2o.analytics.domain.model;

import lombok.Value;

@Value
public class KeyMismatch {

    long rawRowCount;
    long aggregateRowCount;
    double rawPrimaryValue;
    double aggregatePrimaryValue;

    /**
     * Largest of the two relative deltas, in percent.
     */
    double deltaPercent;
}
