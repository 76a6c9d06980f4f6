package com.backoffice.ledger.service;

import com.backoffice.ledger.dto.CustomerLedger;
import com.backoffice.ledger.dto.LedgerEntry;
import com.backoffice.ledger.dto.LedgerEntryType;
import com.backoffice.ledger.exception.InvalidArgumentException;
import com.backoffice.ledger.exception.NotFoundException;
import com.backoffice.ledger.model.CreditApplication;
import com.backoffice.ledger.model.Customer;
import com.backoffice.ledger.model.CustomerPayment;
import com.backoffice.ledger.model.Invoice;
import com.backoffice.ledger.model.InvoiceStatusPolicy;
import com.backoffice.ledger.model.PaymentApplication;
import com.backoffice.ledger.repository.CreditApplicationRepository;
import com.backoffice.ledger.repository.CustomerRepository;
import com.backoffice.ledger.repository.InvoiceRepository;
import com.backoffice.ledger.repository.PaymentApplicationRepository;
import com.backoffice.ledger.util.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a customer's statement: invoices as debits, payment and credit
 * applications as credits, in chronological order with a running balance.
 */
@Service
public class CustomerLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(CustomerLedgerService.class);

    static final Comparator<LedgerEntry> ENTRY_ORDER = Comparator
            .comparing(LedgerEntry::getDate)
            .thenComparing(LedgerEntry::getType)
            .thenComparing(LedgerEntry::getSourceId);

    private final CustomerRepository customerRepository;
    private final InvoiceRepository invoiceRepository;
    private final PaymentApplicationRepository paymentApplicationRepository;
    private final CreditApplicationRepository creditApplicationRepository;

    public CustomerLedgerService(CustomerRepository customerRepository, InvoiceRepository invoiceRepository,
            PaymentApplicationRepository paymentApplicationRepository,
            CreditApplicationRepository creditApplicationRepository) {
        this.customerRepository = customerRepository;
        this.invoiceRepository = invoiceRepository;
        this.paymentApplicationRepository = paymentApplicationRepository;
        this.creditApplicationRepository = creditApplicationRepository;
    }

    /**
     * @param startDate inclusive; null for the start of the account
     * @param endDate   inclusive; null for no upper bound
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public CustomerLedger getLedger(Long customerId, LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new InvalidArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new NotFoundException("Customer", customerId));

        List<Invoice> invoices = invoiceRepository.findByCustomerId(customerId).stream()
                .filter(i -> !InvoiceStatusPolicy.NON_CHARGEABLE.contains(i.getStatus()))
                .collect(Collectors.toList());
        List<PaymentApplication> paymentApplications = paymentApplicationRepository.findByCustomerId(customerId);
        List<CreditApplication> creditApplications = creditApplicationRepository.findByCustomerId(customerId);

        BigDecimal opening = MoneyUtils.orZero(customer.getOpeningBalance());
        List<LedgerEntry> entries = new ArrayList<>();

        for (Invoice invoice : invoices) {
            LocalDate date = invoice.getInvoiceDate();
            if (isBefore(date, startDate)) {
                opening = opening.add(invoice.getTotalAmount());
            } else if (isWithin(date, endDate)) {
                entries.add(new LedgerEntry(date, LedgerEntryType.INVOICE, invoice.getId(), invoice.getId(),
                        invoice.getInvoiceNumber(), "Invoice " + invoice.getInvoiceNumber(),
                        invoice.getTotalAmount(), null));
            }
        }

        for (PaymentApplication application : paymentApplications) {
            CustomerPayment payment = application.getPayment();
            LocalDate date = payment.getPaymentDate();
            if (isBefore(date, startDate)) {
                opening = opening.subtract(application.getAmountApplied());
            } else if (isWithin(date, endDate)) {
                String reference = payment.getReferenceNumber() != null ? payment.getReferenceNumber()
                        : "PAY-" + payment.getId();
                entries.add(new LedgerEntry(date, LedgerEntryType.PAYMENT, application.getId(),
                        application.getInvoice().getId(), reference,
                        "Payment (" + payment.getPaymentMethod().getLabel() + ") - "
                                + application.getInvoice().getInvoiceNumber(),
                        null, application.getAmountApplied()));
            }
        }

        for (CreditApplication application : creditApplications) {
            LocalDate date = application.getAppliedDate();
            if (isBefore(date, startDate)) {
                opening = opening.subtract(application.getAmountApplied());
            } else if (isWithin(date, endDate)) {
                entries.add(new LedgerEntry(date, LedgerEntryType.CREDIT_APPLICATION, application.getId(),
                        application.getInvoice().getId(), "CR-" + application.getCredit().getId(),
                        "Credit applied - " + application.getInvoice().getInvoiceNumber(),
                        null, application.getAmountApplied()));
            }
        }

        entries.sort(ENTRY_ORDER);

        BigDecimal running = opening;
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            running = running.add(entry.getDebit()).subtract(entry.getCredit());
            entry.setBalance(running);
            totalDebits = totalDebits.add(entry.getDebit());
            totalCredits = totalCredits.add(entry.getCredit());
        }

        Boolean reconciled = null;
        if (endDate == null) {
            reconciled = reconcile(customer, invoices, running);
        }

        return CustomerLedger.builder()
                .customerId(customer.getId())
                .customerName(customer.getDisplayName())
                .startDate(startDate)
                .endDate(endDate)
                .openingBalance(opening)
                .transactions(entries)
                .closingBalance(running)
                .totalDebits(totalDebits)
                .totalCredits(totalCredits)
                .netMovement(totalDebits.subtract(totalCredits))
                .reconciled(reconciled)
                .build();
    }

    // An open-ended ledger must close on exactly what the invoices still say is owed
    private boolean reconcile(Customer customer, List<Invoice> invoices, BigDecimal closing) {
        BigDecimal outstanding = invoices.stream()
                .map(i -> MoneyUtils.orZero(i.getBalance()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal expected = MoneyUtils.orZero(customer.getOpeningBalance()).add(outstanding);
        if (closing.compareTo(expected) != 0) {
            logger.error("Ledger for customer {} does not reconcile: closing balance {} but invoices show {} owed",
                    customer.getId(), closing, expected);
            return false;
        }
        return true;
    }

    private static boolean isBefore(LocalDate date, LocalDate startDate) {
        return startDate != null && date.isBefore(startDate);
    }

    private static boolean isWithin(LocalDate date, LocalDate endDate) {
        return endDate == null || !date.isAfter(endDate);
    }
}
