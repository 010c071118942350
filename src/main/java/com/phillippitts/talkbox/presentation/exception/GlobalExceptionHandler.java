package com.phillippitts.talkbox.presentation.exception;

import com.phillippitts.talkbox.exception.InvalidAudioException;
import com.phillippitts.talkbox.exception.TalkBoxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        LOG.debug("Request validation failed: {}", details);
        return badRequest(ex, "Invalid request", details);
    }

    /**
     * Client error - body missing or not valid JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.debug("Unreadable request body: {}", ex.getMessage());
        return badRequest(ex, "Malformed request body", "Expected a JSON object");
    }

    /**
     * Client error - unknown source or unsupported value (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.debug("Rejected request: {}", ex.getMessage());
        return badRequest(ex, "Invalid request", ex.getMessage());
    }

    /**
     * Client error - audio buffer rejected (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: sample={}, reason={}", ex.getSampleIndex(), ex.getReason());
        return badRequest(ex, "Invalid audio", ex.getMessage());
    }

    /**
     * Collaborator failure - retry possible (HTTP 503).
     */
    @ExceptionHandler(TalkBoxException.class)
    ResponseEntity<ApiError> handleTalkBoxFailure(TalkBoxException ex) {
        LOG.error("Request failed: {}", ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Check the server log for details",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(Exception ex, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    private static String describe(FieldError e) {
        return e.getField() + ": " + e.getDefaultMessage();
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
