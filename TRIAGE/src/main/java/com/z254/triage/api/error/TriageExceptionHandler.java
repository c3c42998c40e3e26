package com.z254.triage.api.error;

import com.z254.triage.domain.exception.IncidentNotFoundException;
import com.z254.triage.domain.exception.IncidentValidationException;
import com.z254.triage.domain.exception.InvalidStatusException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;

/**
 * Maps triage errors to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class TriageExceptionHandler {

    private final Clock clock;

    public TriageExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(IncidentValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(IncidentValidationException ex,
                                                          ServerWebExchange exchange) {
        ErrorResponse error = build(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), exchange);
        error.setMissingFields(ex.getMissingFields());
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(IncidentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(IncidentNotFoundException ex,
                                                        ServerWebExchange exchange) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), exchange));
    }

    @ExceptionHandler(InvalidStatusException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStatus(InvalidStatusException ex,
                                                             ServerWebExchange exchange) {
        return ResponseEntity.badRequest()
                .body(build(HttpStatus.BAD_REQUEST, "Invalid Status", ex.getMessage(), exchange));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(ServerWebInputException ex,
                                                        ServerWebExchange exchange) {
        log.debug("Malformed request: {}", ex.getReason());
        return ResponseEntity.badRequest()
                .body(build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getReason(), exchange));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error handling {}", exchange.getRequest().getPath(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                        "An unexpected error occurred", exchange));
    }

    private ErrorResponse build(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(clock.instant())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }
}
