package com.flagship.split_ledger.common.exception;

import com.flagship.split_ledger.balance.UnbalancedBalancesException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Maps ledger exceptions to HTTP responses.
 *
 * Status mapping:
 * - 400: malformed request or ledger rule violated
 * - 403: member acting on a record they do not own (a settlement, a group's details)
 * - 404: unknown group, expense, settlement or member
 * - 409: version conflict the caller must resolve by re-reading
 * - 500: stored data breaks an invariant (never a client error)
 * - 503: store unavailable, safe to retry
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "MISSING_HEADER",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing
                ));
        log.warn("Request validation failed: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Request validation failed", errors);
    }

    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ErrorResponse> handleLedgerValidation(LedgerValidationException e) {
        log.warn("Ledger rule violated [{}]: {}", e.getCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenOperationException e) {
        log.warn("Forbidden [{}]: {}", e.getCode(), e.getMessage());
        return respond(HttpStatus.FORBIDDEN, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RecordNotFoundException e) {
        log.debug("{}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e) {
        log.info("Version conflict on {} after {} attempt(s)", e.getRecordId(), e.getAttempts());
        return respond(HttpStatus.CONFLICT, "VERSION_CONFLICT", e.getMessage(),
                Map.of("record_id", String.valueOf(e.getRecordId())));
    }

    @ExceptionHandler(DataIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(DataIntegrityException e) {
        log.error("Integrity violation in group {}: {}", e.getGroupId(), e.getViolations());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "DATA_INTEGRITY",
                "Stored records for this group are inconsistent", Map.of("group_id", e.getGroupId()));
    }

    @ExceptionHandler(UnbalancedBalancesException.class)
    public ResponseEntity<ErrorResponse> handleUnbalanced(UnbalancedBalancesException e) {
        log.error("Balances for {} do not sum to zero (residue={})", e.getCurrency(), e.getResidue());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNBALANCED_BALANCES", e.getMessage(), null);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        log.warn("Store unavailable: {}", e.getMessage(), e.getCause());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE",
                "Ledger store is temporarily unavailable, retry later", null);
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(CancellationException e) {
        log.warn("Request cancelled: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CANCELLED", "Request was cancelled before commit", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "INVALID_STATE", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  Map<String, String> details) {
        ErrorResponse error = ErrorResponse.builder()
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
