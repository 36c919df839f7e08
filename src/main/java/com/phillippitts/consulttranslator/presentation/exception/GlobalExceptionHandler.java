package com.phillippitts.consulttranslator.presentation.exception;

import com.phillippitts.consulttranslator.exception.ConfigurationException;
import com.phillippitts.consulttranslator.exception.RecordingException;
import com.phillippitts.consulttranslator.exception.RecordingNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping file system details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - unusable language pair (HTTP 400).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.warn("Invalid configuration: primary={}, secondary={}",
                ex.getPrimaryLanguage(), ex.getSecondaryLanguage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid conversation configuration",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - malformed recording name (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    @ExceptionHandler(RecordingNotFoundException.class)
    ResponseEntity<ApiError> handleRecordingNotFound(RecordingNotFoundException ex) {
        LOG.info("Recording not found: {}", ex.getFileName());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording not found",
                ex.getFileName(),
                Instant.now()
            ));
    }

    /**
     * Storage failure (HTTP 500). The path is logged but not returned.
     */
    @ExceptionHandler(RecordingException.class)
    ResponseEntity<ApiError> handleRecordingFailure(RecordingException ex) {
        LOG.error("Recording storage failed: path={}", ex.getPath(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording storage unavailable",
                "Please retry later",
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
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
