package com.backoffice.ledger.service;

import com.backoffice.ledger.dto.AllocationPreview;
import com.backoffice.ledger.dto.AllocationPreviewLine;
import com.backoffice.ledger.dto.AllocationResult;
import com.backoffice.ledger.dto.InvoiceAllocation;
import com.backoffice.ledger.dto.PreviewAllocationRequest;
import com.backoffice.ledger.dto.RecordPaymentRequest;
import com.backoffice.ledger.exception.InvalidArgumentException;
import com.backoffice.ledger.exception.InvalidOperationException;
import com.backoffice.ledger.exception.NotFoundException;
import com.backoffice.ledger.model.*;
import com.backoffice.ledger.repository.*;
import com.backoffice.ledger.util.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class PaymentAllocationService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentAllocationService.class);

    private final CustomerRepository customerRepository;
    private final InvoiceRepository invoiceRepository;
    private final CustomerPaymentRepository paymentRepository;
    private final PaymentApplicationRepository paymentApplicationRepository;
    private final CreditRepository creditRepository;
    private final AllocationPlanner allocationPlanner;
    private final LedgerTransactionRunner transactionRunner;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PaymentAllocationService(CustomerRepository customerRepository, InvoiceRepository invoiceRepository,
            CustomerPaymentRepository paymentRepository, PaymentApplicationRepository paymentApplicationRepository,
            CreditRepository creditRepository, AllocationPlanner allocationPlanner,
            LedgerTransactionRunner transactionRunner, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.customerRepository = customerRepository;
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.paymentApplicationRepository = paymentApplicationRepository;
        this.creditRepository = creditRepository;
        this.allocationPlanner = allocationPlanner;
        this.transactionRunner = transactionRunner;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Records a payment and spreads it over the customer's open invoices,
     * oldest due first. Whatever is left becomes one customer credit.
     * Payment, applications, balance updates and credit commit together or
     * not at all.
     */
    public AllocationResult allocate(RecordPaymentRequest request) {
        request.validate();
        BigDecimal amount = MoneyUtils.requirePositive(request.getAmount(), "amount");

        AllocationResult result = transactionRunner.execute("record-payment",
                () -> recordAndAllocate(request, amount));

        logger.info("Payment {} recorded for customer {}: {} allocated to {} invoice(s), {} as credit",
                result.getPaymentId(), request.getCustomerId(), result.getTotalAllocated(),
                result.getInvoicesAffected().size(), result.getTotalCredit());
        return result;
    }

    /**
     * Shows what {@link #allocate} would do with the same inputs right now.
     * Writes nothing.
     */
    @Transactional(readOnly = true)
    public AllocationPreview preview(PreviewAllocationRequest request) {
        if (request.getCustomerId() == null) {
            throw new InvalidArgumentException("customerId is required");
        }
        BigDecimal amount = MoneyUtils.requirePositive(request.getAmount(), "amount");
        Customer customer = customerRepository.findById(request.getCustomerId())
                .orElseThrow(() -> new NotFoundException("Customer", request.getCustomerId()));

        AllocationPlan plan = allocationPlanner.plan(loadTargetInvoices(customer, request.getInvoiceIds()), amount);

        List<AllocationPreviewLine> lines = plan.getLines().stream()
                .map(line -> new AllocationPreviewLine(
                        line.getInvoice().getId(),
                        line.getInvoice().getInvoiceNumber(),
                        line.getInvoice().getDueDate(),
                        line.getInvoice().getBalance(),
                        line.getAmountToApply(),
                        line.getBalanceAfter()))
                .collect(Collectors.toList());

        return AllocationPreview.builder()
                .amount(amount)
                .totalAllocated(plan.getTotalAllocated())
                .totalCredit(plan.getRemainder())
                .lines(lines)
                .build();
    }

    private AllocationResult recordAndAllocate(RecordPaymentRequest request, BigDecimal amount) {
        // Serializes against every other payment or credit application for this customer
        Customer customer = customerRepository.findByIdForUpdate(request.getCustomerId())
                .orElseThrow(() -> new NotFoundException("Customer", request.getCustomerId()));
        LocalDate today = LocalDate.now(clock);

        AllocationPlan plan = allocationPlanner.plan(loadTargetInvoices(customer, request.getInvoiceIds()), amount);

        // 1. Record Payment
        CustomerPayment payment = new CustomerPayment();
        payment.setCustomer(customer);
        payment.setAmount(amount);
        payment.setPaymentMethod(request.getPaymentMethod());
        payment.setPaymentDate(request.getPaymentDate() != null ? request.getPaymentDate() : today);
        payment.setReferenceNumber(request.getReferenceNumber());
        payment.setNotes(request.getNotes());
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setAllocatedAmount(plan.getTotalAllocated());
        payment.setCreditAmount(plan.getRemainder());
        payment.setRecordedBy(request.getRecordedBy());
        paymentRepository.save(payment);

        // 2. Apply to invoices in plan order
        List<InvoiceAllocation> affected = new ArrayList<>();
        for (AllocationPlan.Line line : plan.getLines()) {
            Invoice invoice = line.getInvoice();

            PaymentApplication application = new PaymentApplication();
            application.setPayment(payment);
            application.setInvoice(invoice);
            application.setAmountApplied(line.getAmountToApply());
            application.setNotes("Allocated from payment " + payment.getId());
            paymentApplicationRepository.save(application);

            invoice.reduceBalance(line.getAmountToApply(), today);
            invoiceRepository.save(invoice);

            affected.add(new InvoiceAllocation(invoice.getId(), invoice.getInvoiceNumber(),
                    line.getAmountToApply(), invoice.getBalance(), invoice.getStatus()));
        }

        // 3. Overpayment becomes credit
        Credit credit = null;
        if (plan.getRemainder().signum() > 0) {
            credit = new Credit();
            credit.setCustomer(customer);
            credit.setAmount(plan.getRemainder());
            credit.setAvailableAmount(plan.getRemainder());
            credit.setStatus(CreditStatus.ACTIVE);
            credit.setReason(CreditReason.OVERPAYMENT);
            credit.setDescription("Overpayment on payment " + payment.getId()
                    + (payment.getReferenceNumber() != null ? " (" + payment.getReferenceNumber() + ")" : ""));
            credit.setSourcePayment(payment);
            credit.setCreatedBy(request.getRecordedBy());
            creditRepository.save(credit);
            logger.debug("Credit {} of {} created for customer {}", credit.getId(), credit.getAmount(),
                    customer.getId());
        }

        AllocationResult result = AllocationResult.builder()
                .paymentId(payment.getId())
                .totalPaid(amount)
                .totalAllocated(plan.getTotalAllocated())
                .totalCredit(plan.getRemainder())
                .creditId(credit != null ? credit.getId() : null)
                .invoicesAffected(affected)
                .build();

        eventPublisher.publishEvent(new LedgerAuditEvent(request.getRecordedBy(), LedgerAuditEvent.RECORD_PAYMENT,
                "CUSTOMER_PAYMENT", String.valueOf(payment.getId()), null, paymentSnapshot(payment, result)));
        return result;
    }

    /**
     * Either every open invoice of the customer, or exactly the requested
     * ones. A requested invoice that cannot take money fails the whole call.
     */
    private List<Invoice> loadTargetInvoices(Customer customer, List<Long> invoiceIds) {
        if (invoiceIds == null || invoiceIds.isEmpty()) {
            return invoiceRepository.findAllocatableByCustomerId(customer.getId(), InvoiceStatusPolicy.ALLOCATABLE);
        }

        Set<Long> requested = new LinkedHashSet<>(invoiceIds);
        if (requested.contains(null)) {
            throw new InvalidArgumentException("invoiceIds must not contain null entries");
        }
        Map<Long, Invoice> found = invoiceRepository.findByIdIn(requested).stream()
                .collect(Collectors.toMap(Invoice::getId, i -> i));

        List<Invoice> invoices = new ArrayList<>();
        for (Long id : requested) {
            Invoice invoice = found.get(id);
            if (invoice == null) {
                throw new NotFoundException("Invoice", id);
            }
            if (!invoice.getCustomer().getId().equals(customer.getId())) {
                throw new InvalidOperationException("Invoice " + invoice.getInvoiceNumber()
                        + " does not belong to customer " + customer.getId());
            }
            if (!InvoiceStatusPolicy.isAllocatable(invoice)) {
                throw new InvalidOperationException("Invoice " + invoice.getInvoiceNumber()
                        + " cannot receive payments (status " + invoice.getStatus() + ", balance "
                        + invoice.getBalance() + ")");
            }
            invoices.add(invoice);
        }
        return invoices;
    }

    private Map<String, Object> paymentSnapshot(CustomerPayment payment, AllocationResult result) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("customerId", payment.getCustomer().getId());
        snapshot.put("amount", payment.getAmount());
        snapshot.put("paymentMethod", payment.getPaymentMethod());
        snapshot.put("paymentDate", payment.getPaymentDate());
        snapshot.put("referenceNumber", payment.getReferenceNumber());
        snapshot.put("allocatedAmount", result.getTotalAllocated());
        snapshot.put("creditAmount", result.getTotalCredit());
        snapshot.put("creditId", result.getCreditId());
        snapshot.put("invoiceCount", result.getInvoicesAffected().size());
        snapshot.put("invoices", result.getInvoicesAffected().stream()
                .map(InvoiceAllocation::getInvoiceNumber)
                .collect(Collectors.toList()));
        return snapshot;
    }
}
