package com.flagship.contractor_ledger.api;

import com.flagship.contractor_ledger.exception.ConstraintViolationException;
import com.flagship.contractor_ledger.exception.IntegrityException;
import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.exception.TransactionStateException;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.persistence.IntegrityViolation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger errors to HTTP responses with one consistent body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Invalid input: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e) {
        log.warn("Rejected by ledger rules: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Constraint Violation", e.getMessage(), null);
    }

    @ExceptionHandler(TransactionStateException.class)
    public ResponseEntity<ErrorResponse> handleTransactionState(TransactionStateException e) {
        log.warn("Invalid transaction state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(IntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(IntegrityException e) {
        log.error("Integrity check failed: {} violation(s)", e.getViolations().size());

        Map<String, String> details = new LinkedHashMap<>();
        int index = 0;
        for (IntegrityViolation violation : e.getViolations()) {
            details.put(violation.getCheck() + "[" + index++ + "]", violation.getDetail());
        }
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Integrity Violation", e.getMessage(), details);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleArgumentNotValid(MethodArgumentNotValidException e) {
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

    /**
     * Unknown codes in a request body surface here, wrapped by Jackson around a
     * {@link ValidationException}.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getCause();
        while (cause != null && !(cause instanceof ValidationException)) {
            cause = cause.getCause();
        }
        String message = cause != null ? cause.getMessage() : "Malformed request body";
        log.warn("Unreadable request: {}", message);
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", message, null);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("Bad request parameter: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
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
