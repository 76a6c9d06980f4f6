package com.backoffice.ledger.dto;

import com.backoffice.ledger.model.InvoiceStatus;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class InvoiceAllocation {
    Long invoiceId;
    String invoiceNumber;
    BigDecimal amountApplied;
    BigDecimal newBalance;
    InvoiceStatus newStatus;
}
