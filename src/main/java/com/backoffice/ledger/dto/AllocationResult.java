package com.backoffice.ledger.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a recorded payment. {@code totalAllocated + totalCredit} always
 * equals {@code totalPaid}.
 */
@Value
@Builder
public class AllocationResult {
    Long paymentId;
    BigDecimal totalPaid;
    BigDecimal totalAllocated;
    BigDecimal totalCredit;
    Long creditId; // null when the payment was fully allocated
    List<InvoiceAllocation> invoicesAffected;

    // Spelled out for the payer, who may not expect part of the money to become credit
    public String getSummary() {
        String summary = "Allocated " + totalAllocated + " of " + totalPaid + " to "
                + invoicesAffected.size() + " invoice(s)";
        if (totalCredit.signum() > 0) {
            summary += "; " + totalCredit + " kept as customer credit";
        }
        return summary;
    }
}
