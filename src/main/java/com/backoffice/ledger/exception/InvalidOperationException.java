package com.backoffice.ledger.exception;

public class InvalidOperationException extends LedgerException {

    public InvalidOperationException(String message) {
        super(message);
    }

    @Override
    public LedgerErrorKind getKind() {
        return LedgerErrorKind.INVALID_OPERATION;
    }
}
