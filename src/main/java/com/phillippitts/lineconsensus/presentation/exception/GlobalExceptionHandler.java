package com.phillippitts.lineconsensus.presentation.exception;

import com.phillippitts.lineconsensus.exception.InvalidClassificationException;
import com.phillippitts.lineconsensus.exception.MalformedRecordException;
import com.phillippitts.lineconsensus.exception.ReductionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping transcription text out of 500 responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - classification payload cannot be extracted (HTTP 400).
     */
    @ExceptionHandler(InvalidClassificationException.class)
    ResponseEntity<ApiError> handleInvalidClassification(InvalidClassificationException ex) {
        LOG.warn("Invalid classification: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), "Invalid classification payload", ex.getMessage());
    }

    /**
     * Client error - a line record is missing a coordinate or its text (HTTP 400).
     */
    @ExceptionHandler(MalformedRecordException.class)
    ResponseEntity<ApiError> handleMalformedRecord(MalformedRecordException ex) {
        LOG.warn("Malformed record: field={}, reason={}", ex.getField(), ex.getReason());
        return badRequest(ex.getClass().getSimpleName(), "Malformed line record", ex.getMessage());
    }

    /**
     * Client error - request body is not valid JSON for the endpoint (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("MalformedRequest", "Request body could not be read",
                "Check the JSON shape of the request");
    }

    /**
     * Subject could not be reduced from the given extracts (HTTP 422).
     */
    @ExceptionHandler(ReductionException.class)
    ResponseEntity<ApiError> handleReductionFailure(ReductionException ex) {
        LOG.warn("Reduction failed: subject={}, frame={}", ex.getSubjectId(), ex.getFrame());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Subject could not be reduced",
                ex.getMessage(),
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

    private static ResponseEntity<ApiError> badRequest(String errorCode, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, message, details, Instant.now()));
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
