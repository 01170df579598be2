package com.dinoventures.ledger.exception;

import com.dinoventures.ledger.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to JSON error bodies.
 *
 * LedgerException            → 422 (transaction rejected, ledger unchanged)
 * AccountNotFoundException   → 404
 * validation / bad input     → 400
 * anything else              → 500, logged with stack trace
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerRejection(LedgerException e) {
        log.warn("Ledger rejected request: code={}, message={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(error(e.getCode(), e.getMessage(), detailsOf(e)));
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AccountNotFoundException e) {
        log.warn("{}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(error("NOT_FOUND", e.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        fieldError -> fieldError.getField(),
                        fieldError -> fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing
                ));
        log.warn("Validation failed: {}", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error("VALIDATION_FAILED", "Request validation failed", errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error("BAD_REQUEST", "Malformed request: " + e.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("INTERNAL_ERROR", "An unexpected error occurred", null));
    }

    private static Map<String, String> detailsOf(LedgerException e) {
        Map<String, String> details = new HashMap<>();
        if (e instanceof TransactionSequenceException) {
            details.put("latest_date", ((TransactionSequenceException) e).getLatestDate().toString());
        } else if (e instanceof TransactionLimitException) {
            TransactionLimitException limit = (TransactionLimitException) e;
            details.put("limit_type", limit.getLimitType().name().toLowerCase(Locale.ROOT));
            details.put("limit", String.valueOf(limit.getLimit()));
        }
        return details.isEmpty() ? null : details;
    }

    private static ErrorResponse error(String code, String message, Map<String, String> details) {
        return ErrorResponse.builder()
                .error(code)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
    }
}
