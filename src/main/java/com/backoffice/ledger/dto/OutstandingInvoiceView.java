package com.backoffice.ledger.dto;

import com.backoffice.ledger.model.InvoiceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class OutstandingInvoiceView {
    Long id;
    String invoiceNumber;
    Long customerId;
    String customerName;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal balance;
    InvoiceStatus status;
    boolean overdue;
}
