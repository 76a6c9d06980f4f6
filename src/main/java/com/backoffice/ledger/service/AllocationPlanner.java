package com.backoffice.ledger.service;

import com.backoffice.ledger.model.Invoice;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Oldest-due-first allocation. Shared by recording and previewing a payment
 * so the two can never disagree. Performs no I/O.
 */
@Component
public class AllocationPlanner {

    /** Due date ascending with undated invoices last, then invoice date, then id. */
    public static final Comparator<Invoice> ALLOCATION_ORDER = Comparator
            .comparing(Invoice::getDueDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(Invoice::getInvoiceDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(Invoice::getId, Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    public AllocationPlan plan(List<Invoice> invoices, BigDecimal amount) {
        List<Invoice> ordered = new ArrayList<>(invoices);
        ordered.sort(ALLOCATION_ORDER);

        List<AllocationPlan.Line> lines = new ArrayList<>();
        BigDecimal remaining = amount;

        for (Invoice invoice : ordered) {
            if (remaining.signum() <= 0)
                break;

            BigDecimal due = invoice.getBalance();
            if (due == null || due.signum() <= 0)
                continue;

            BigDecimal allocation = due.min(remaining);
            lines.add(new AllocationPlan.Line(invoice, allocation));
            remaining = remaining.subtract(allocation);
        }

        return new AllocationPlan(amount, lines, remaining);
    }
}
