package com.phillippitts.answercoach.presentation.exception;

import com.phillippitts.answercoach.exception.ConfigurationException;
import com.phillippitts.answercoach.exception.SessionNotFoundException;
import com.phillippitts.answercoach.exception.SessionStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(SessionNotFoundException ex) {
        LOG.warn("Session not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Session not found", ex.getMessage());
    }

    /**
     * Lifecycle conflict, e.g. feeding or finalizing a finalized session (HTTP 409).
     */
    @ExceptionHandler(SessionStateException.class)
    ResponseEntity<ApiError> handleState(SessionStateException ex) {
        LOG.warn("Rejected request for session {}: {}", ex.getSessionId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(),
                "Session cannot accept this request", ex.getMessage());
    }

    /**
     * Client error - invalid session definition (HTTP 400).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.warn("Invalid session definition: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid session definition", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleMalformed(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Malformed request",
                "Request body or path could not be parsed");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static String describe(FieldError fe) {
        return fe.getField() + " " + fe.getDefaultMessage();
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
