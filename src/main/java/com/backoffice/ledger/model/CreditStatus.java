package com.backoffice.ledger.model;

public enum CreditStatus {
    ACTIVE,
    EXHAUSTED,
    CANCELLED
}
