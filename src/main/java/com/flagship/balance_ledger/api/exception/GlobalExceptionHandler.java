package com.flagship.balance_ledger.api.exception;

import com.flagship.balance_ledger.integrity.LedgerIntegrityException;
import com.flagship.balance_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.balance_ledger.ledger.exception.TransferRetriesExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the ledger's error taxonomy onto HTTP statuses.
 *
 * 400 validation, 404 unknown account, 409 broken invariant, 422 constraint violation
 * in the database, 503 lock contention or lost connection.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body could not be parsed", null);
    }

    /**
     * Covers InvalidTransferException and InvalidAccountException.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAccountNotFound(AccountNotFoundException e) {
        log.warn("Account not found: {}", e.getAccountId());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(),
            Map.of("accountId", String.valueOf(e.getAccountId())));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Constraint Violation",
            "The ledger rejected the write; check that both accounts exist", null);
    }

    @ExceptionHandler(LedgerIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrityFailure(LedgerIntegrityException e) {
        log.error("Integrity failure: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Integrity Failure", e.getMessage(), null);
    }

    @ExceptionHandler(TransferRetriesExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleRetriesExhausted(TransferRetriesExhaustedException e) {
        log.error("Transfer retries exhausted after {} attempts", e.getAttempts());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Contention",
            "Transfer was not applied due to lock contention; it is safe to retry",
            Map.of("attempts", String.valueOf(e.getAttempts())));
    }

    @ExceptionHandler({DataAccessResourceFailureException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleConnectionLost(RuntimeException e) {
        log.error("Database unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Database Unavailable",
            "The database connection failed; the outcome of the request is unknown", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
