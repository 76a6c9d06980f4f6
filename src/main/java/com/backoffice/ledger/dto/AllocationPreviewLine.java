package com.backoffice.ledger.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class AllocationPreviewLine {
    Long invoiceId;
    String invoiceNumber;
    LocalDate dueDate;
    BigDecimal currentBalance;
    BigDecimal amountToApply;
    BigDecimal balanceAfter;
}
