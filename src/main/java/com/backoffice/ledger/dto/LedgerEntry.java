package com.backoffice.ledger.dto;

import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class LedgerEntry {
    private LocalDate date;
    private LedgerEntryType type;
    private Long sourceId; // invoice, payment application or credit application id
    private Long invoiceId;
    private String reference;
    private String description;

    private BigDecimal debit; // Increases Balance (Invoice)
    private BigDecimal credit; // Decreases Balance (Payment/Credit application)
    private BigDecimal balance; // Running Balance

    public LedgerEntry(LocalDate date, LedgerEntryType type, Long sourceId, Long invoiceId, String reference,
            String description, BigDecimal debit, BigDecimal credit) {
        this.date = date;
        this.type = type;
        this.sourceId = sourceId;
        this.invoiceId = invoiceId;
        this.reference = reference;
        this.description = description;
        this.debit = debit != null ? debit : BigDecimal.ZERO;
        this.credit = credit != null ? credit : BigDecimal.ZERO;
    }
}
