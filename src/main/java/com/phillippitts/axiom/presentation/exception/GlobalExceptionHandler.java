package com.phillippitts.axiom.presentation.exception;

import com.phillippitts.axiom.exception.AxiomException;
import com.phillippitts.axiom.exception.EventValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * <p>Turn failures never reach this class; {@code submitTurn} reports them in its outcome.
 * What arrives here are bad requests and failures of the history and session endpoints.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid argument (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, EventValidationException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + ' ' + e.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Request body is invalid");
        LOG.warn("Invalid request body: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("InvalidRequestBody", "Invalid request", details, Instant.now()));
    }

    /**
     * Transient error - store or bus unavailable (HTTP 503).
     */
    @ExceptionHandler(AxiomException.class)
    ResponseEntity<ApiError> handleAxiomFailure(AxiomException ex) {
        LOG.error("Request failed [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getErrorCode().code(),
                ex.getUserMessage(),
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
