package com.flagship.wager_escrow.wager.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the wager exception hierarchy and Spring MVC binding failures onto
 * {@link ApiError} responses.
 *
 * <pre>
 *   WagerValidationException   422
 *   WagerPermissionException   403
 *   StateConflictException     409 (+ current_state)
 *   EscrowHoldFailedException  422
 *   EscrowUnavailableException 503 (retryable)
 *   WagerNotFoundException     404
 *   binding / missing header   400
 * </pre>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(WagerValidationException.class)
    public ResponseEntity<ApiError> handleValidation(WagerValidationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", e);
    }

    @ExceptionHandler(WagerPermissionException.class)
    public ResponseEntity<ApiError> handlePermission(WagerPermissionException e) {
        return respond(HttpStatus.FORBIDDEN, "Forbidden", e);
    }

    @ExceptionHandler(StateConflictException.class)
    public ResponseEntity<ApiError> handleStateConflict(StateConflictException e) {
        log.warn("State conflict: reason={}, currentState={}, message={}",
                e.getReason(), e.getCurrentState(), e.getMessage());
        ApiError error = ApiError.builder()
            .error("State Conflict")
            .reason(e.getReason())
            .message(e.getMessage())
            .currentState(e.getCurrentState())
            .retryable(false)
            .timestamp(Instant.now(clock))
            .build();
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(EscrowHoldFailedException.class)
    public ResponseEntity<ApiError> handleHoldFailed(EscrowHoldFailedException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Escrow Hold Failed", e);
    }

    @ExceptionHandler(EscrowUnavailableException.class)
    public ResponseEntity<ApiError> handleEscrowUnavailable(EscrowUnavailableException e) {
        log.error("Escrow unavailable: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Escrow Unavailable", e);
    }

    @ExceptionHandler(WagerNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(WagerNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", e);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        return badRequest("Missing Required Parameter",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest("Invalid Request", "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());
        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));
        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return badRequest("Invalid Request", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return badRequest("Invalid Request", e.getMessage(), null);
    }

    /**
     * A unique constraint lost a race, for example two creates with one
     * Idempotency-Key. Repeating the request returns the winner's result.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Concurrent write conflict: {}", e.getMostSpecificCause().getMessage());
        ApiError error = ApiError.builder()
            .error("Conflict")
            .reason("CONCURRENT_MODIFICATION")
            .message("The request conflicted with a concurrent request; retry it")
            .retryable(true)
            .timestamp(Instant.now(clock))
            .build();
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .reason("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now(clock))
            .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, WagerException e) {
        log.warn("{}: reason={}, message={}", error, e.getReason(), e.getMessage());
        ApiError body = ApiError.builder()
            .error(error)
            .reason(e.getReason())
            .message(e.getMessage())
            .retryable(e.isRetryable())
            .timestamp(Instant.now(clock))
            .build();
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ApiError> badRequest(String error, String message, Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .reason(WagerValidationException.INVALID_REQUEST)
            .message(message)
            .details(details)
            .timestamp(Instant.now(clock))
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
