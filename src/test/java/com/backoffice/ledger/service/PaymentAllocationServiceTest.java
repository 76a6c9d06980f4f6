package com.backoffice.ledger.service;

import com.backoffice.ledger.dto.AllocationResult;
import com.backoffice.ledger.dto.RecordPaymentRequest;
import com.backoffice.ledger.exception.InvalidArgumentException;
import com.backoffice.ledger.exception.InvalidOperationException;
import com.backoffice.ledger.exception.NotFoundException;
import com.backoffice.ledger.model.*;
import com.backoffice.ledger.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentAllocationServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private InvoiceRepository invoiceRepository;
    @Mock
    private CustomerPaymentRepository paymentRepository;
    @Mock
    private PaymentApplicationRepository paymentApplicationRepository;
    @Mock
    private CreditRepository creditRepository;
    @Mock
    private LedgerTransactionRunner transactionRunner;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PaymentAllocationService paymentAllocationService;
    private Customer customer;
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
        paymentAllocationService = new PaymentAllocationService(customerRepository, invoiceRepository,
                paymentRepository, paymentApplicationRepository, creditRepository, new AllocationPlanner(),
                transactionRunner, eventPublisher, clock);

        customer = new Customer();
        customer.setId(1L);
        customer.setName("Acme Retail");
    }

    @SuppressWarnings("unchecked")
    private void runTransactionsInline() {
        when(transactionRunner.execute(anyString(), any()))
                .thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(1)).get());
    }

    private void assignIdsOnSave() {
        when(paymentRepository.save(any(CustomerPayment.class))).thenAnswer(inv -> {
            CustomerPayment p = inv.getArgument(0);
            p.setId(ids.incrementAndGet());
            return p;
        });
    }

    private Invoice openInvoice(long id, String balance, LocalDate dueDate) {
        Invoice invoice = new Invoice();
        invoice.setId(id);
        invoice.setInvoiceNumber("INV-" + id);
        invoice.setCustomer(customer);
        invoice.setTotalAmount(new BigDecimal(balance));
        invoice.setBalance(new BigDecimal(balance));
        invoice.setStatus(InvoiceStatus.OPEN);
        invoice.setInvoiceDate(TODAY.minusDays(30));
        invoice.setDueDate(dueDate);
        return invoice;
    }

    private RecordPaymentRequest request(String amount) {
        return RecordPaymentRequest.builder()
                .customerId(1L)
                .amount(new BigDecimal(amount))
                .paymentMethod(PaymentMethod.BANK_TRANSFER)
                .referenceNumber("TRX-77")
                .recordedBy("clerk")
                .build();
    }

    @Test
    void allocate_ShouldRejectNonPositiveAmount_BeforeOpeningTransaction() {
        assertThrows(InvalidArgumentException.class, () -> paymentAllocationService.allocate(request("0")));
        assertThrows(InvalidArgumentException.class, () -> paymentAllocationService.allocate(request("-5.00")));

        verifyNoInteractions(transactionRunner, customerRepository, paymentRepository);
    }

    @Test
    void allocate_ShouldRejectMissingPaymentMethod() {
        RecordPaymentRequest noMethod = request("10.00").toBuilder().paymentMethod(null).build();

        assertThrows(InvalidArgumentException.class, () -> paymentAllocationService.allocate(noMethod));
        verifyNoInteractions(transactionRunner);
    }

    @Test
    void allocate_ShouldFailForUnknownCustomer() {
        runTransactionsInline();
        when(customerRepository.findByIdForUpdate(1L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> paymentAllocationService.allocate(request("10.00")));
        verify(paymentRepository, never()).save(any());
    }

    @Test
    void allocate_ShouldSplitBetweenInvoiceAndCredit() {
        runTransactionsInline();
        assignIdsOnSave();
        Invoice invoice = openInvoice(10L, "700.00", TODAY.plusDays(10));
        when(customerRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        when(invoiceRepository.findAllocatableByCustomerId(eq(1L), any())).thenReturn(List.of(invoice));

        AllocationResult result = paymentAllocationService.allocate(request("1000.00"));

        assertEquals(new BigDecimal("700.00"), result.getTotalAllocated());
        assertEquals(new BigDecimal("300.00"), result.getTotalCredit());
        assertEquals(1, result.getInvoicesAffected().size());
        assertEquals(InvoiceStatus.PAID, invoice.getStatus());
        assertEquals(0, invoice.getBalance().signum());

        ArgumentCaptor<Credit> creditCaptor = ArgumentCaptor.forClass(Credit.class);
        verify(creditRepository).save(creditCaptor.capture());
        Credit credit = creditCaptor.getValue();
        assertEquals(new BigDecimal("300.00"), credit.getAmount());
        assertEquals(new BigDecimal("300.00"), credit.getAvailableAmount());
        assertEquals(CreditReason.OVERPAYMENT, credit.getReason());
        assertEquals(result.getPaymentId(), credit.getSourcePayment().getId());

        ArgumentCaptor<CustomerPayment> paymentCaptor = ArgumentCaptor.forClass(CustomerPayment.class);
        verify(paymentRepository).save(paymentCaptor.capture());
        assertEquals(new BigDecimal("700.00"), paymentCaptor.getValue().getAllocatedAmount());
        assertEquals(new BigDecimal("300.00"), paymentCaptor.getValue().getCreditAmount());
        assertEquals(TODAY, paymentCaptor.getValue().getPaymentDate());

        verify(paymentApplicationRepository).save(any(PaymentApplication.class));
        verify(eventPublisher).publishEvent(any(LedgerAuditEvent.class));
    }

    @Test
    void allocate_ShouldNotCreateCredit_WhenFullyAllocated() {
        runTransactionsInline();
        assignIdsOnSave();
        Invoice older = openInvoice(10L, "400.00", TODAY.minusDays(5));
        Invoice newer = openInvoice(11L, "400.00", TODAY.plusDays(5));
        when(customerRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        when(invoiceRepository.findAllocatableByCustomerId(eq(1L), any())).thenReturn(List.of(newer, older));

        AllocationResult result = paymentAllocationService.allocate(request("500.00"));

        assertNull(result.getCreditId());
        assertEquals(0, result.getTotalCredit().signum());
        assertEquals(10L, result.getInvoicesAffected().get(0).getInvoiceId());
        assertEquals(InvoiceStatus.PAID, older.getStatus());
        assertEquals(new BigDecimal("300.00"), newer.getBalance());
        assertEquals(InvoiceStatus.PARTIAL, newer.getStatus());
        verify(creditRepository, never()).save(any());
    }

    @Test
    void allocate_ShouldRejectExplicitInvoiceOfAnotherCustomer() {
        runTransactionsInline();
        Customer other = new Customer();
        other.setId(2L);
        Invoice foreign = openInvoice(20L, "100.00", null);
        foreign.setCustomer(other);
        when(customerRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        when(invoiceRepository.findByIdIn(any())).thenReturn(List.of(foreign));

        RecordPaymentRequest targeted = request("50.00").toBuilder().invoiceIds(List.of(20L)).build();

        assertThrows(InvalidOperationException.class, () -> paymentAllocationService.allocate(targeted));
        verify(paymentRepository, never()).save(any());
        assertEquals(new BigDecimal("100.00"), foreign.getBalance());
    }

    @Test
    void allocate_ShouldRejectUnknownExplicitInvoice() {
        runTransactionsInline();
        when(customerRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        when(invoiceRepository.findByIdIn(any())).thenReturn(List.of());

        RecordPaymentRequest targeted = request("50.00").toBuilder().invoiceIds(List.of(99L)).build();

        assertThrows(NotFoundException.class, () -> paymentAllocationService.allocate(targeted));
    }
}
