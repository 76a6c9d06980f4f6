package com.backoffice.ledger.config;

import com.backoffice.ledger.exception.ApiError;
import com.backoffice.ledger.exception.InvalidOperationException;
import com.backoffice.ledger.exception.LedgerErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void accessDenied_ShouldBeForbiddenWithoutLedgerKind() {
        ResponseEntity<ApiError> response = handler.handleAccessDenied(new AccessDeniedException("denied"));

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        assertNull(response.getBody().getKind());
        assertEquals("Insufficient permissions", response.getBody().getMessage());
    }

    @Test
    void businessRuleFailure_ShouldKeepItsKind() {
        ResponseEntity<ApiError> response = handler.handleLedgerException(
                new InvalidOperationException("Credit 4 is not active"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals(LedgerErrorKind.INVALID_OPERATION, response.getBody().getKind());
    }

    @Test
    void exhaustedLockRetries_ShouldBeConflict() {
        ResponseEntity<ApiError> response = handler.handleConflict(
                new PessimisticLockingFailureException("lock wait timeout"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals(LedgerErrorKind.CONFLICT, response.getBody().getKind());
    }
}
