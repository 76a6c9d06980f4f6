package com.backoffice.ledger.dto;

/**
 * Declaration order is the same-day ordering: new charges are listed before
 * money received against them.
 */
public enum LedgerEntryType {
    INVOICE,
    PAYMENT,
    CREDIT_APPLICATION
}
