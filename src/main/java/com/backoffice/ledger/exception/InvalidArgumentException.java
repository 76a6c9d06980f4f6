package com.backoffice.ledger.exception;

public class InvalidArgumentException extends LedgerException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    @Override
    public LedgerErrorKind getKind() {
        return LedgerErrorKind.INVALID_ARGUMENT;
    }
}
