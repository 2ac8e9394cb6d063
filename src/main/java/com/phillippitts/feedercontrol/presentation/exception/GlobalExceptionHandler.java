package com.phillippitts.feedercontrol.presentation.exception;

import com.phillippitts.feedercontrol.exception.CommandTimeoutException;
import com.phillippitts.feedercontrol.exception.DeviceConnectionException;
import com.phillippitts.feedercontrol.exception.SettingsValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

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

    /**
     * Client error - invalid settings update (HTTP 400).
     */
    @ExceptionHandler(SettingsValidationException.class)
    ResponseEntity<ApiError> handleInvalidSettings(SettingsValidationException ex) {
        LOG.warn("Rejected settings update: field={}, reason={}", ex.getField(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid scheduler settings",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - malformed or constraint-violating request body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        String details = ex instanceof MethodArgumentNotValidException invalid
            ? invalid.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "))
            : "Request body is missing or not valid JSON";
        LOG.warn("Bad request: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Invalid request",
                details,
                Instant.now()
            ));
    }

    /**
     * Device not connected - the reader keeps reconnecting in the background (HTTP 503).
     */
    @ExceptionHandler(DeviceConnectionException.class)
    ResponseEntity<ApiError> handleDeviceUnavailable(DeviceConnectionException ex) {
        LOG.warn("Device unavailable: address={}, reason={}", ex.getAddress(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Feeder device unavailable",
                "Device is not connected. Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Device did not answer in time (HTTP 504).
     */
    @ExceptionHandler(CommandTimeoutException.class)
    ResponseEntity<ApiError> handleCommandTimeout(CommandTimeoutException ex) {
        LOG.warn("Command timed out: command={}, timeout={}ms", ex.getCommand(), ex.getTimeout().toMillis());
        return ResponseEntity
            .status(HttpStatus.GATEWAY_TIMEOUT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Feeder device did not respond",
                "No complete response within " + ex.getTimeout().toMillis() + "ms",
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
