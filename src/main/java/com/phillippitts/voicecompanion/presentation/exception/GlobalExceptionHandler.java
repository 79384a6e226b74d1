package com.phillippitts.voicecompanion.presentation.exception;

import com.phillippitts.voicecompanion.exception.EmptyInputException;
import com.phillippitts.voicecompanion.exception.OwnerOnlyException;
import com.phillippitts.voicecompanion.exception.RateLimitedException;
import com.phillippitts.voicecompanion.exception.RetriesExhaustedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping internal details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Too many requests for a guild (HTTP 429 with Retry-After in whole seconds).
     */
    @ExceptionHandler(RateLimitedException.class)
    ResponseEntity<ApiError> handleRateLimited(RateLimitedException ex) {
        LOG.debug("Rate limited: guild={}, retryAfterMs={}", ex.getGuildId(), ex.getRetryAfterMs());
        long retryAfterSeconds = Math.max(1, (ex.getRetryAfterMs() + 999) / 1000);
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Too many requests",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - nothing left to speak (HTTP 400).
     */
    @ExceptionHandler(EmptyInputException.class)
    ResponseEntity<ApiError> handleEmptyInput(EmptyInputException ex) {
        LOG.debug("Empty input after sanitization: guild={}", ex.getGuildId());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Nothing to say",
                "Text is empty after removing mentions",
                Instant.now()
            ));
    }

    /**
     * Transient error - voice gateway unreachable, retry possible (HTTP 503).
     */
    @ExceptionHandler(RetriesExhaustedException.class)
    ResponseEntity<ApiError> handleRetriesExhausted(RetriesExhaustedException ex) {
        LOG.warn("Voice connect gave up: guild={}, channel={}, attempts={}",
            ex.getGuildId(), ex.getChannelId(), ex.getAttempts());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Could not connect to the voice channel",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    @ExceptionHandler(OwnerOnlyException.class)
    ResponseEntity<ApiError> handleOwnerOnly(OwnerOnlyException ex) {
        return ResponseEntity
            .status(HttpStatus.FORBIDDEN)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Forbidden",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Malformed or invalid request body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Invalid request",
                "Request body is missing or has invalid fields",
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
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
