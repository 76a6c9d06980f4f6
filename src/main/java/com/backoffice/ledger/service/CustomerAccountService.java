package com.backoffice.ledger.service;

import com.backoffice.ledger.dto.CollectionsSummary;
import com.backoffice.ledger.dto.CreditView;
import com.backoffice.ledger.dto.CustomerCredits;
import com.backoffice.ledger.dto.OpenInvoiceView;
import com.backoffice.ledger.dto.OpenInvoices;
import com.backoffice.ledger.dto.OutstandingInvoiceView;
import com.backoffice.ledger.dto.PaymentHistory;
import com.backoffice.ledger.dto.PaymentView;
import com.backoffice.ledger.exception.InvalidArgumentException;
import com.backoffice.ledger.exception.NotFoundException;
import com.backoffice.ledger.model.*;
import com.backoffice.ledger.repository.*;
import com.backoffice.ledger.util.MoneyUtils;
import com.backoffice.ledger.util.OffsetPageRequest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only views over a customer's account for the collections screens.
 */
@Service
@Transactional(readOnly = true)
public class CustomerAccountService {

    static final int MAX_PAGE_SIZE = 100;

    private final CustomerRepository customerRepository;
    private final InvoiceRepository invoiceRepository;
    private final CustomerPaymentRepository paymentRepository;
    private final PaymentApplicationRepository paymentApplicationRepository;
    private final CreditRepository creditRepository;
    private final CreditApplicationRepository creditApplicationRepository;
    private final Clock clock;

    public CustomerAccountService(CustomerRepository customerRepository, InvoiceRepository invoiceRepository,
            CustomerPaymentRepository paymentRepository, PaymentApplicationRepository paymentApplicationRepository,
            CreditRepository creditRepository, CreditApplicationRepository creditApplicationRepository,
            Clock clock) {
        this.customerRepository = customerRepository;
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.paymentApplicationRepository = paymentApplicationRepository;
        this.creditRepository = creditRepository;
        this.creditApplicationRepository = creditApplicationRepository;
        this.clock = clock;
    }

    /**
     * @param activeOnly only credits that can still be applied
     */
    public CustomerCredits getCustomerCredits(Long customerId, boolean activeOnly) {
        requireCustomer(customerId);

        List<Credit> credits = activeOnly
                ? creditRepository.findUsableByCustomerId(customerId, CreditStatus.ACTIVE)
                : creditRepository.findByCustomerIdOrderByCreatedAtDescIdDesc(customerId);

        Map<Long, List<CreditApplication>> applicationsByCredit = creditApplicationRepository
                .findByCustomerId(customerId).stream()
                .collect(Collectors.groupingBy(ca -> ca.getCredit().getId()));

        List<CreditView> views = credits.stream()
                .map(credit -> toView(credit,
                        applicationsByCredit.getOrDefault(credit.getId(), Collections.emptyList())))
                .collect(Collectors.toList());

        BigDecimal totalAvailable = credits.stream()
                .filter(Credit::isActive)
                .map(Credit::getAvailableAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new CustomerCredits(views, totalAvailable);
    }

    /**
     * Newest payments first.
     *
     * @param page 1-based
     */
    public PaymentHistory getCustomerPayments(Long customerId, int page, int size) {
        if (page < 1) {
            throw new InvalidArgumentException("page must be 1 or greater");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new InvalidArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        requireCustomer(customerId);

        Page<CustomerPayment> payments = paymentRepository.findByCustomerId(customerId,
                PageRequest.of(page - 1, size, Sort.by(Sort.Direction.DESC, "paymentDate", "id")));

        List<Long> paymentIds = payments.getContent().stream()
                .map(CustomerPayment::getId)
                .collect(Collectors.toList());
        Map<Long, List<PaymentApplication>> applicationsByPayment = paymentIds.isEmpty()
                ? Collections.emptyMap()
                : paymentApplicationRepository.findByPaymentIdIn(paymentIds).stream()
                        .collect(Collectors.groupingBy(pa -> pa.getPayment().getId()));

        List<PaymentView> views = payments.getContent().stream()
                .map(payment -> toView(payment,
                        applicationsByPayment.getOrDefault(payment.getId(), Collections.emptyList())))
                .collect(Collectors.toList());

        return new PaymentHistory(views, payments.getTotalElements(), payments.getTotalPages(), page, size);
    }

    /**
     * Invoices that can still take money, in the order a payment would be
     * applied to them.
     */
    public OpenInvoices getOpenInvoices(Long customerId) {
        requireCustomer(customerId);
        LocalDate today = LocalDate.now(clock);

        List<OpenInvoiceView> invoices = invoiceRepository
                .findAllocatableByCustomerId(customerId, InvoiceStatusPolicy.ALLOCATABLE).stream()
                .sorted(AllocationPlanner.ALLOCATION_ORDER)
                .map(invoice -> new OpenInvoiceView(invoice.getId(), invoice.getInvoiceNumber(),
                        invoice.getInvoiceDate(), invoice.getDueDate(), invoice.getTotalAmount(),
                        invoice.getBalance(), invoice.getStatus(), invoice.isOverdue(today)))
                .collect(Collectors.toList());

        BigDecimal totalOutstanding = invoices.stream()
                .map(OpenInvoiceView::getBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new OpenInvoices(invoices, invoices.size(), totalOutstanding);
    }

    /**
     * Latest payments across all customers.
     *
     * @param paymentMethod null for every method
     * @param search        matched case-insensitively against customer name,
     *                      company name and payment reference
     */
    public List<PaymentView> getRecentPayments(int limit, int offset, PaymentMethod paymentMethod, String search) {
        List<CustomerPayment> payments = paymentRepository.findRecent(paymentMethod, likePattern(search),
                offsetPage(limit, offset));
        if (payments.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> paymentIds = payments.stream()
                .map(CustomerPayment::getId)
                .collect(Collectors.toList());
        Map<Long, List<PaymentApplication>> applicationsByPayment = paymentApplicationRepository
                .findByPaymentIdIn(paymentIds).stream()
                .collect(Collectors.groupingBy(pa -> pa.getPayment().getId()));

        return payments.stream()
                .map(payment -> toView(payment,
                        applicationsByPayment.getOrDefault(payment.getId(), Collections.emptyList())))
                .collect(Collectors.toList());
    }

    /**
     * Invoices still owing money across all customers, in allocation order.
     *
     * @param search matched case-insensitively against customer name, company
     *               name and invoice number
     */
    public List<OutstandingInvoiceView> getOutstandingInvoices(int limit, int offset, String search) {
        LocalDate today = LocalDate.now(clock);
        return invoiceRepository.findOutstanding(InvoiceStatusPolicy.ALLOCATABLE, likePattern(search),
                offsetPage(limit, offset)).stream()
                .map(invoice -> OutstandingInvoiceView.builder()
                        .id(invoice.getId())
                        .invoiceNumber(invoice.getInvoiceNumber())
                        .customerId(invoice.getCustomer().getId())
                        .customerName(invoice.getCustomer().getDisplayName())
                        .invoiceDate(invoice.getInvoiceDate())
                        .dueDate(invoice.getDueDate())
                        .balance(invoice.getBalance())
                        .status(invoice.getStatus())
                        .overdue(invoice.isOverdue(today))
                        .build())
                .collect(Collectors.toList());
    }

    public CollectionsSummary getCollectionsSummary() {
        LocalDate today = LocalDate.now(clock);
        return new CollectionsSummary(
                MoneyUtils.orZero(paymentRepository.sumAmountBetween(today, today)),
                MoneyUtils.orZero(paymentRepository.sumAmountBetween(today.withDayOfMonth(1), today)),
                MoneyUtils.orZero(invoiceRepository.sumOutstandingBalance(InvoiceStatusPolicy.ALLOCATABLE)),
                MoneyUtils.orZero(creditRepository.sumAvailableAmountByStatus(CreditStatus.ACTIVE)));
    }

    private static OffsetPageRequest offsetPage(int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new InvalidArgumentException("offset must not be negative");
        }
        return OffsetPageRequest.of(offset, limit);
    }

    private static String likePattern(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        return "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
    }

    private void requireCustomer(Long customerId) {
        if (!customerRepository.existsById(customerId)) {
            throw new NotFoundException("Customer", customerId);
        }
    }

    private CreditView toView(Credit credit, List<CreditApplication> applications) {
        return CreditView.builder()
                .id(credit.getId())
                .amount(credit.getAmount())
                .availableAmount(credit.getAvailableAmount())
                .status(credit.getStatus())
                .reason(credit.getReason())
                .description(credit.getDescription())
                .sourcePaymentId(credit.getSourcePayment() != null ? credit.getSourcePayment().getId() : null)
                .createdBy(credit.getCreatedBy())
                .createdAt(credit.getCreatedAt())
                .applications(applications.stream()
                        .map(ca -> new CreditView.Application(ca.getInvoice().getId(),
                                ca.getInvoice().getInvoiceNumber(), ca.getAmountApplied(), ca.getAppliedDate(),
                                ca.getAppliedBy()))
                        .collect(Collectors.toList()))
                .build();
    }

    private PaymentView toView(CustomerPayment payment, List<PaymentApplication> applications) {
        return PaymentView.builder()
                .id(payment.getId())
                .customerId(payment.getCustomer().getId())
                .customerName(payment.getCustomer().getDisplayName())
                .amount(payment.getAmount())
                .paymentMethod(payment.getPaymentMethod())
                .paymentDate(payment.getPaymentDate())
                .referenceNumber(payment.getReferenceNumber())
                .notes(payment.getNotes())
                .status(payment.getStatus())
                .allocatedAmount(payment.getAllocatedAmount())
                .creditAmount(payment.getCreditAmount())
                .recordedBy(payment.getRecordedBy())
                .applications(applications.stream()
                        .map(pa -> new PaymentView.Application(pa.getInvoice().getId(),
                                pa.getInvoice().getInvoiceNumber(), pa.getAmountApplied()))
                        .collect(Collectors.toList()))
                .build();
    }
}
