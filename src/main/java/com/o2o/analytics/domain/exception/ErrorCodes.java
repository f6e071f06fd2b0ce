package com.o2o.analytics.domain.exception;

public final class ErrorCodes {

    public static final int INVALID_QUERY = 4000;
    public static final int DEFINITION_NOT_FOUND = 4040;
    public static final int ENGINE_FAILURE = 5000;
    public static final int SEGMENT_REBUILD_FAILED = 5001;
    public static final int ENGINE_UNAVAILABLE = 5030;
    public static final int QUERY_TIMEOUT = 5040;

    private ErrorCodes() {
    }
}
