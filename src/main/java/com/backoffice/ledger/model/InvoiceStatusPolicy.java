package com.backoffice.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Derives an invoice's status from its balance, total and due date.
 * DRAFT and CANCELLED are set explicitly by the invoice lifecycle and are
 * never replaced by a derived value.
 */
public final class InvoiceStatusPolicy {

    /** Statuses whose invoices may receive payments or credits. */
    public static final Set<InvoiceStatus> ALLOCATABLE = EnumSet.of(
            InvoiceStatus.OPEN, InvoiceStatus.PARTIAL, InvoiceStatus.OVERDUE);

    /** Statuses that do not represent a charge to the customer. */
    public static final Set<InvoiceStatus> NON_CHARGEABLE = EnumSet.of(
            InvoiceStatus.DRAFT, InvoiceStatus.CANCELLED);

    private InvoiceStatusPolicy() {
    }

    public static InvoiceStatus derive(InvoiceStatus current, BigDecimal balance, BigDecimal totalAmount,
            LocalDate dueDate, LocalDate today) {
        if (current != null && NON_CHARGEABLE.contains(current)) {
            return current;
        }
        if (balance.signum() == 0) {
            return InvoiceStatus.PAID;
        }
        if (dueDate != null && dueDate.isBefore(today)) {
            return InvoiceStatus.OVERDUE;
        }
        if (balance.compareTo(totalAmount) < 0) {
            return InvoiceStatus.PARTIAL;
        }
        return InvoiceStatus.OPEN;
    }

    public static boolean isAllocatable(Invoice invoice) {
        return ALLOCATABLE.contains(invoice.getStatus())
                && invoice.getBalance() != null
                && invoice.getBalance().signum() > 0;
    }
}
