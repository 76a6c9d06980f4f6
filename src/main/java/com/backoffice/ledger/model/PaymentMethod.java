package com.backoffice.ledger.model;

public enum PaymentMethod {
    CASH("Cash"),
    BANK_TRANSFER("Bank Transfer"),
    CHEQUE("Cheque"),
    CARD("Card Payment"),
    MOBILE_MONEY("Mobile Money");

    private final String label;

    PaymentMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
