package com.backoffice.ledger.exception;

/**
 * Terminal failure of a ledger operation. Raised before any mutation, or inside
 * the transaction, which then rolls back as a whole.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    public abstract LedgerErrorKind getKind();
}
