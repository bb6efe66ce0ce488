package com.auraflux.dispatch.api;

import com.auraflux.core.error.AurafluxException;
import com.auraflux.core.error.GateDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions to HTTP status codes and {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GateDeniedException.class)
    public ResponseEntity<ErrorResponse> handleGateDenied(GateDeniedException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.code(), e.getMessage(), e.reasons()));
    }

    @ExceptionHandler(AurafluxException.class)
    public ResponseEntity<ErrorResponse> handleDomain(AurafluxException e) {
        HttpStatus status = statusFor(e.code());
        if (status.is5xxServerError()) {
            log.warn("Request rejected with {}: {}", e.code(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.code(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.code(), e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_REQUEST", e.getMessage()));
    }

    static HttpStatus statusFor(String code) {
        return switch (code) {
            case "NOT_FOUND", "UNKNOWN_REQUEST" -> HttpStatus.NOT_FOUND;
            case "VERSION_CONFLICT", "DUPLICATE_IN_FLIGHT", "QUESTION_LOCKED", "ITEM_LOCKED", "SESSION_CLOSED",
                 "STALE_RESULT", "CHAT_UNAVAILABLE" -> HttpStatus.CONFLICT;
            case "GATE_DENIED" -> HttpStatus.UNPROCESSABLE_ENTITY;
            case "TASK_TYPE_UNKNOWN" -> HttpStatus.BAD_REQUEST;
            case "LANE_SATURATED" -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
