package com.backoffice.ledger.service;

import com.backoffice.ledger.model.Invoice;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * How an amount would be spread over a customer's invoices. Nothing in here
 * has been written yet; {@link PaymentAllocationService} executes it.
 */
@Value
public class AllocationPlan {
    BigDecimal amount;
    List<Line> lines;
    BigDecimal remainder; // left over once every invoice is covered

    public BigDecimal getTotalAllocated() {
        return amount.subtract(remainder);
    }

    @Value
    public static class Line {
        Invoice invoice;
        BigDecimal amountToApply;

        public BigDecimal getBalanceAfter() {
            return invoice.getBalance().subtract(amountToApply);
        }
    }
}
