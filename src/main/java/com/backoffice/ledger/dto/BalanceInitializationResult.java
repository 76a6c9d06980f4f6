package com.backoffice.ledger.dto;

import lombok.Value;

import java.util.List;

@Value
public class BalanceInitializationResult {
    int updatedCount;
    List<Long> skippedInvoiceIds; // applications exceed the invoice total; needs manual review
}
