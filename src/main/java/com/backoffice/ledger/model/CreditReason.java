package com.backoffice.ledger.model;

public enum CreditReason {
    OVERPAYMENT
}
