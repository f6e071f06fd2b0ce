package com.o2o.analytics.domain.model;

public enum SyncMode {
    /**
     * Only segments whose source version moved are recomputed.
     */
    INCREMENTAL,
    /**
     * Every segment in the window is recomputed.
     */
    FULL
}
