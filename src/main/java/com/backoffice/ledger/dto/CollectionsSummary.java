package com.backoffice.ledger.dto;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CollectionsSummary {
    BigDecimal totalPaymentsToday;
    BigDecimal totalPaymentsThisMonth;
    BigDecimal totalOutstanding;
    BigDecimal totalCredits;
}
