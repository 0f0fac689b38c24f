package com.flagship.banking_ledger.api;

import com.flagship.banking_ledger.error.LedgerErrorKind;
import com.flagship.banking_ledger.error.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger error kinds to HTTP statuses. Storage faults and unexpected errors get a generic
 * message; their detail is only logged.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    static final String GENERIC_STORAGE_MESSAGE = "The ledger could not complete the operation, please retry later";
    static final String GENERIC_INTERNAL_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        LedgerErrorKind kind = e.getKind();
        HttpStatus status = kind.getHttpStatus();

        String message;
        if (kind.isInternal()) {
            log.error("Ledger storage error: kind={}", kind, e);
            message = GENERIC_STORAGE_MESSAGE;
        } else {
            log.warn("Ledger request rejected: kind={}, reason={}", kind, e.getMessage());
            message = e.getMessage();
        }

        return ResponseEntity.status(status).body(ApiError.builder()
            .error(status.getReasonPhrase())
            .kind(kind.name())
            .message(message)
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return badRequest("Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return badRequest("Request body is missing or malformed", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
            .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
            .kind(INTERNAL_ERROR)
            .message(GENERIC_INTERNAL_MESSAGE)
            .timestamp(Instant.now())
            .build());
    }

    private ResponseEntity<ApiError> badRequest(String message, Map<String, String> details) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
            .kind(INVALID_REQUEST)
            .message(message)
            .timestamp(Instant.now())
            .details(details)
            .build());
    }
}
