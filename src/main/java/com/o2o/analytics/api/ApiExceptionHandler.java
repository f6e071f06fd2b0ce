package com.o2o.analytics.api;

import com.o2o.analytics.domain.exception.DefinitionNotFoundException;
import com.o2o.analytics.domain.exception.EngineException;
import com.o2o.analytics.domain.exception.EngineUnavailableException;
import com.o2o.analytics.domain.exception.ErrorCodes;
import com.o2o.analytics.domain.exception.InvalidQueryException;
import com.o2o.analytics.domain.exception.QueryTimeoutException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps engine exceptions to JSON error bodies.
 *
 * - DefinitionNotFoundException: 404
 * - InvalidQueryException, malformed parameters: 400
 * - QueryTimeoutException: 504
 * - EngineUnavailableException: 503
 * - any other EngineException or unexpected failure: 500
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DefinitionNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(DefinitionNotFoundException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage(), request);
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ApiError> handleInvalidQuery(InvalidQueryException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(), request);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(RuntimeException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorCodes.INVALID_QUERY, e.getMessage(), request);
    }

    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(QueryTimeoutException e, HttpServletRequest request) {
        log.warn("Query timed out on {}: {}", request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, e.getErrorCode(), e.getMessage(), request);
    }

    @ExceptionHandler(EngineUnavailableException.class)
    public ResponseEntity<ApiError> handleUnavailable(EngineUnavailableException e, HttpServletRequest request) {
        log.warn("{} unavailable on {}: {}", e.getEngine(), request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage(), request);
    }

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ApiError> handleEngine(EngineException e, HttpServletRequest request) {
        log.error("Engine failure on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected failure on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCodes.ENGINE_FAILURE, "Internal error", request);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, int errorCode, String message,
                                                    HttpServletRequest request) {
        ApiError body = ApiError.builder()
                .status(status.value())
                .errorCode(errorCode)
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
