package com.rtcc.orchestrator.api.rest;

import com.rtcc.orchestrator.core.exception.InvalidStateTransitionException;
import com.rtcc.orchestrator.core.exception.KernelStateException;
import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.exception.OrchestratorException;
import com.rtcc.orchestrator.core.exception.SchemaValidationException;
import com.rtcc.orchestrator.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps orchestration exceptions onto HTTP status codes with a uniform error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({WorkflowValidationException.class, SchemaValidationException.class})
    public ResponseEntity<ErrorResponse> invalid(OrchestratorException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({InvalidStateTransitionException.class, KernelStateException.class})
    public ResponseEntity<ErrorResponse> conflict(OrchestratorException e) {
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }

    /**
     * Remaining orchestration errors describe a request the current state cannot satisfy.
     */
    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<ErrorResponse> orchestration(OrchestratorException e) {
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> illegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> validation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST, "Malformed request body");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message) {
        log.debug("Request failed with {} {}: {}", status.value(), errorCode, message);
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, message, Instant.now()));
    }

    public record ErrorResponse(String errorCode, String message, Instant timestamp) {}
}
