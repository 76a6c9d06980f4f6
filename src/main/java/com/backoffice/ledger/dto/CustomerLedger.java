package com.backoffice.ledger.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class CustomerLedger {
    Long customerId;
    String customerName;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal openingBalance;
    List<LedgerEntry> transactions;
    BigDecimal closingBalance;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    BigDecimal netMovement;
    // Checked against stored invoice balances only for open-ended ledgers; null otherwise
    Boolean reconciled;
}
