package com.backoffice.ledger.model;

/**
 * Payments are recorded only once their allocation has been worked out, so a
 * persisted payment is always complete. Corrections are new reversing records.
 */
public enum PaymentStatus {
    COMPLETED
}
