package com.backoffice.ledger.service;

import com.backoffice.ledger.model.Invoice;
import com.backoffice.ledger.model.InvoiceStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AllocationPlannerTest {

    private static final LocalDate BASE = LocalDate.of(2024, 1, 1);

    private final AllocationPlanner planner = new AllocationPlanner();

    private Invoice invoice(long id, String balance, LocalDate invoiceDate, LocalDate dueDate) {
        Invoice invoice = new Invoice();
        invoice.setId(id);
        invoice.setInvoiceNumber("INV-" + id);
        invoice.setTotalAmount(new BigDecimal(balance));
        invoice.setBalance(new BigDecimal(balance));
        invoice.setStatus(InvoiceStatus.OPEN);
        invoice.setInvoiceDate(invoiceDate);
        invoice.setDueDate(dueDate);
        return invoice;
    }

    private List<Long> invoiceIds(AllocationPlan plan) {
        return plan.getLines().stream().map(l -> l.getInvoice().getId()).collect(Collectors.toList());
    }

    @Test
    void plan_ShouldPayEarliestDueFirst_AndUndatedLast() {
        Invoice undated = invoice(1, "100.00", BASE, null);
        Invoice d3 = invoice(2, "100.00", BASE, BASE.plusDays(30));
        Invoice d1 = invoice(3, "100.00", BASE, BASE.plusDays(10));
        Invoice d2 = invoice(4, "100.00", BASE, BASE.plusDays(20));

        AllocationPlan plan = planner.plan(List.of(undated, d3, d1, d2), new BigDecimal("400.00"));

        assertEquals(List.of(3L, 4L, 2L, 1L), invoiceIds(plan));
        assertEquals(0, plan.getRemainder().signum());
    }

    @Test
    void plan_ShouldBreakDueDateTiesByInvoiceDateThenId() {
        LocalDate due = BASE.plusDays(30);
        Invoice laterIssued = invoice(1, "50.00", BASE.plusDays(5), due);
        Invoice higherId = invoice(3, "50.00", BASE, due);
        Invoice lowerId = invoice(2, "50.00", BASE, due);

        AllocationPlan plan = planner.plan(List.of(laterIssued, higherId, lowerId), new BigDecimal("150.00"));

        assertEquals(List.of(2L, 3L, 1L), invoiceIds(plan));
    }

    @Test
    void plan_ShouldStopWhenAmountRunsOut() {
        Invoice first = invoice(1, "500.00", BASE, BASE.plusDays(1));
        Invoice second = invoice(2, "500.00", BASE, BASE.plusDays(2));
        Invoice third = invoice(3, "500.00", BASE, BASE.plusDays(3));

        AllocationPlan plan = planner.plan(List.of(first, second, third), new BigDecimal("700.00"));

        assertEquals(2, plan.getLines().size());
        assertEquals(new BigDecimal("500.00"), plan.getLines().get(0).getAmountToApply());
        assertEquals(new BigDecimal("200.00"), plan.getLines().get(1).getAmountToApply());
        assertEquals(new BigDecimal("300.00"), plan.getLines().get(1).getBalanceAfter());
        assertEquals(new BigDecimal("700.00"), plan.getTotalAllocated());
        assertEquals(0, plan.getRemainder().signum());
    }

    @Test
    void plan_ShouldLeaveRemainder_WhenPaymentExceedsDebt() {
        Invoice only = invoice(1, "700.00", BASE, BASE.plusDays(1));

        AllocationPlan plan = planner.plan(List.of(only), new BigDecimal("1000.00"));

        assertEquals(new BigDecimal("700.00"), plan.getTotalAllocated());
        assertEquals(new BigDecimal("300.00"), plan.getRemainder());
        assertEquals(0, plan.getLines().get(0).getBalanceAfter().signum());
    }

    @Test
    void plan_ShouldSkipInvoicesWithoutBalance() {
        Invoice settled = invoice(1, "100.00", BASE, BASE.plusDays(1));
        settled.setBalance(new BigDecimal("0.00"));
        Invoice legacy = invoice(2, "100.00", BASE, BASE.plusDays(2));
        legacy.setBalance(null);
        Invoice open = invoice(3, "100.00", BASE, BASE.plusDays(3));

        AllocationPlan plan = planner.plan(List.of(settled, legacy, open), new BigDecimal("60.00"));

        assertEquals(List.of(3L), invoiceIds(plan));
    }

    @Test
    void plan_ShouldReturnWholeAmountAsRemainder_WhenNothingIsOpen() {
        AllocationPlan plan = planner.plan(List.of(), new BigDecimal("25.00"));

        assertTrue(plan.getLines().isEmpty());
        assertEquals(new BigDecimal("25.00"), plan.getRemainder());
        assertEquals(0, plan.getTotalAllocated().signum());
    }
}
