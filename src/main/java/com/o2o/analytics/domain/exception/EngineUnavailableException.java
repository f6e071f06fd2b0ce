package com.o2o.analytics.domain.exception;

import com.o2o.analytics.domain.model.EngineType;
import lombok.Getter;

/**
 * Engine cannot serve the request (not initialized, or window not covered).
 * The router treats this as routine and uses another engine.
 */
@Getter
public class EngineUnavailableException extends EngineException {

    private final EngineType engine;

    public EngineUnavailableException(EngineType engine, String message) {
        super(ErrorCodes.ENGINE_UNAVAILABLE, message);
        this.engine = engine;
    }
}
