package com.backoffice.ledger.service;

import com.backoffice.ledger.LedgerFixtures;
import com.backoffice.ledger.dto.BalanceInitializationResult;
import com.backoffice.ledger.dto.RecordPaymentRequest;
import com.backoffice.ledger.model.*;
import com.backoffice.ledger.repository.CustomerPaymentRepository;
import com.backoffice.ledger.repository.InvoiceRepository;
import com.backoffice.ledger.repository.PaymentApplicationRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
@Import(LedgerFixtures.class)
class BalanceInitializationServiceTest {

    @Autowired
    private BalanceInitializationService balanceInitializationService;
    @Autowired
    private PaymentAllocationService paymentAllocationService;
    @Autowired
    private InvoiceRepository invoiceRepository;
    @Autowired
    private CustomerPaymentRepository paymentRepository;
    @Autowired
    private PaymentApplicationRepository paymentApplicationRepository;
    @Autowired
    private LedgerFixtures fixtures;

    private final LocalDate today = LocalDate.now();

    @Test
    void initializeBalances_ShouldRebuildMissingAndDriftedBalances() {
        Customer customer = fixtures.customer("Legacy");
        Invoice legacy = fixtures.invoice(customer, "500.00", today.minusDays(10), today.plusDays(20));
        paymentAllocationService.allocate(RecordPaymentRequest.builder()
                .customerId(customer.getId())
                .amount(new BigDecimal("200.00"))
                .paymentMethod(PaymentMethod.CASH)
                .build());
        legacy.setBalance(null);
        invoiceRepository.save(legacy);

        Invoice drifted = fixtures.invoice(customer, "80.00", today.minusDays(40), today.minusDays(10));
        drifted.setBalance(new BigDecimal("999.00"));
        invoiceRepository.save(drifted);

        BalanceInitializationResult first = balanceInitializationService.initializeBalances("admin");

        assertTrue(first.getUpdatedCount() >= 2);
        Invoice rebuilt = invoiceRepository.findById(legacy.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("300.00").compareTo(rebuilt.getBalance()));
        assertEquals(InvoiceStatus.PARTIAL, rebuilt.getStatus());
        Invoice repaired = invoiceRepository.findById(drifted.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("80.00").compareTo(repaired.getBalance()));
        assertEquals(InvoiceStatus.OVERDUE, repaired.getStatus());

        BalanceInitializationResult second = balanceInitializationService.initializeBalances("admin");
        assertEquals(0, second.getUpdatedCount());
    }

    @Test
    void initializeBalances_ShouldSkipOverAppliedInvoices() {
        Customer customer = fixtures.customer("Over-applied");
        Invoice invoice = fixtures.invoice(customer, "100.00", today.minusDays(5), null);

        // Written directly: the engine itself never applies more than an invoice's balance
        CustomerPayment payment = new CustomerPayment();
        payment.setCustomer(customer);
        payment.setAmount(new BigDecimal("150.00"));
        payment.setPaymentMethod(PaymentMethod.CASH);
        payment.setPaymentDate(today);
        payment.setAllocatedAmount(new BigDecimal("150.00"));
        payment.setCreditAmount(BigDecimal.ZERO);
        paymentRepository.save(payment);
        PaymentApplication application = new PaymentApplication();
        application.setPayment(payment);
        application.setInvoice(invoice);
        application.setAmountApplied(new BigDecimal("150.00"));
        paymentApplicationRepository.save(application);

        BalanceInitializationResult result = balanceInitializationService.initializeBalances("admin");

        assertTrue(result.getSkippedInvoiceIds().contains(invoice.getId()));
        assertEquals(new BigDecimal("100.00"), invoiceRepository.findById(invoice.getId()).orElseThrow().getBalance());
    }
}
