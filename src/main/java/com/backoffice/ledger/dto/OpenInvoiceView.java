package com.backoffice.ledger.dto;

import com.backoffice.ledger.model.InvoiceStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class OpenInvoiceView {
    Long id;
    String invoiceNumber;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal totalAmount;
    BigDecimal balance;
    InvoiceStatus status;
    boolean overdue;
}
