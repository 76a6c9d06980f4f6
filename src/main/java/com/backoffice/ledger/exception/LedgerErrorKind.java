package com.backoffice.ledger.exception;

public enum LedgerErrorKind {
    NOT_FOUND,
    INVALID_ARGUMENT,
    INVALID_OPERATION,
    CONFLICT,
    INTERNAL
}
