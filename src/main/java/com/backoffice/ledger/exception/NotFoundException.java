package com.backoffice.ledger.exception;

public class NotFoundException extends LedgerException {

    public NotFoundException(String entityType, Object id) {
        super(entityType + " not found: " + id);
    }

    @Override
    public LedgerErrorKind getKind() {
        return LedgerErrorKind.NOT_FOUND;
    }
}
