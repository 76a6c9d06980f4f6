package com.backoffice.ledger.model;

public enum InvoiceStatus {
    DRAFT,
    OPEN,
    PARTIAL,
    PAID,
    OVERDUE,
    CANCELLED
}
