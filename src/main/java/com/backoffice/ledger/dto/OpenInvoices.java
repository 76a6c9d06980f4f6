package com.backoffice.ledger.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A customer's payable invoices, listed in the order a payment would be applied.
 */
@Value
public class OpenInvoices {
    List<OpenInvoiceView> invoices;
    int totalInvoices;
    BigDecimal totalOutstanding;
}
