package com.o2o.analytics.domain.exception;

/**
 * An engine call or a wait on another caller's computation exceeded its deadline.
 */
public class QueryTimeoutException extends EngineException {

    public QueryTimeoutException(String message) {
        super(ErrorCodes.QUERY_TIMEOUT, message);
    }

    public QueryTimeoutException(String message, Throwable cause) {
        super(ErrorCodes.QUERY_TIMEOUT, message, cause);
    }
}
