package com.backoffice.ledger.dto;

import com.backoffice.ledger.model.CreditStatus;
import com.backoffice.ledger.model.InvoiceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreditApplicationResult {
    Long creditId;
    Long invoiceId;
    BigDecimal amountApplied;
    BigDecimal creditRemaining;
    CreditStatus creditStatus;
    BigDecimal invoiceNewBalance;
    InvoiceStatus invoiceStatus;
}
