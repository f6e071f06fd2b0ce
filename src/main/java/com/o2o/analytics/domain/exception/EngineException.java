package com.o2o.analytics.domain.exception;

import lombok.Getter;

/**
 * Base class of engine failures. Carries a numeric error code reported to clients.
 */
@Getter
public class EngineException extends RuntimeException {

    private final int errorCode;

    public EngineException(int errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EngineException(int errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
