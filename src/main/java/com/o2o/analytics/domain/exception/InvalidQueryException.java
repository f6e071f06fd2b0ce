package com.o2o.analytics.domain.exception;

/**
 * Malformed filter or window. Never retried.
 */
public class InvalidQueryException extends EngineException {

    public InvalidQueryException(String message) {
        super(ErrorCodes.INVALID_QUERY, message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(ErrorCodes.INVALID_QUERY, message, cause);
    }
}
