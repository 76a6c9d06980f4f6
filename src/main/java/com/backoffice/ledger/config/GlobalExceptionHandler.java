package com.backoffice.ledger.config;

import com.backoffice.ledger.exception.ApiError;
import com.backoffice.ledger.exception.LedgerErrorKind;
import com.backoffice.ledger.exception.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException ex) {
        logger.warn("Ledger operation rejected ({}): {}", ex.getKind(), ex.getMessage());
        return build(statusFor(ex.getKind()), ex.getKind(), ex.getMessage(), null);
    }

    // Raised once the retry budget for lock timeouts / version clashes is spent
    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ApiError> handleConflict(ConcurrencyFailureException ex) {
        logger.warn("Concurrent modification not resolved by retries: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, LedgerErrorKind.CONFLICT,
                "The customer's balances were modified concurrently. Please retry.", null);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class })
    public ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        logger.warn("Malformed request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, LedgerErrorKind.INVALID_ARGUMENT, "Malformed request",
                Map.of("cause", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex) {
        // Not a ledger failure, so no kind
        return build(HttpStatus.FORBIDDEN, null, "Insufficient permissions", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleException(Exception ex) {
        logger.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, LedgerErrorKind.INTERNAL, "An unexpected error occurred", null);
    }

    private HttpStatus statusFor(LedgerErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT:
                return HttpStatus.BAD_REQUEST;
            case INVALID_OPERATION:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<ApiError> build(HttpStatus status, LedgerErrorKind kind, String message,
            Map<String, String> details) {
        ApiError body = ApiError.builder()
                .error(status.getReasonPhrase())
                .kind(kind)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
