package com.metricrecon.reconciliation.controller;

import com.metricrecon.common.exception.FailureKind;
import com.metricrecon.common.exception.ReconciliationException;
import com.metricrecon.reconciliation.dto.ErrorDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine failures to HTTP status codes by {@link FailureKind}:
 * <pre>
 *   UNKNOWN_SOURCE, REVIEW_NOT_FOUND   → 404
 *   REVIEW_CLOSED, CONCURRENT_UPDATE   → 409
 *   NO_USABLE_DATA                     → 422
 *   malformed request                  → 400
 *   anything else                      → 500
 * </pre>
 */
@RestControllerAdvice
public class ReconciliationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationExceptionHandler.class);

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorDTO> reconciliationFailure(ReconciliationException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Unhandled reconciliation failure. kind={} subject={}", e.getKind(), e.getSubject(), e);
        }
        return respond(status, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorDTO> badRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    static HttpStatus statusFor(FailureKind kind) {
        return switch (kind) {
            case UNKNOWN_SOURCE, REVIEW_NOT_FOUND   -> HttpStatus.NOT_FOUND;
            case REVIEW_CLOSED, CONCURRENT_UPDATE   -> HttpStatus.CONFLICT;
            case NO_USABLE_DATA                     -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_CONFIGURATION, PERSISTENCE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorDTO> respond(HttpStatus status, Exception e) {
        return ResponseEntity.status(status)
            .body(new ErrorDTO(e.getClass().getSimpleName(), e.getMessage()));
    }
}
