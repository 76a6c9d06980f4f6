package com.backoffice.ledger.service;

import com.backoffice.ledger.dto.ApplyCreditRequest;
import com.backoffice.ledger.dto.CreditApplicationResult;
import com.backoffice.ledger.exception.InvalidOperationException;
import com.backoffice.ledger.exception.NotFoundException;
import com.backoffice.ledger.model.Credit;
import com.backoffice.ledger.model.CreditApplication;
import com.backoffice.ledger.model.Invoice;
import com.backoffice.ledger.model.InvoiceStatusPolicy;
import com.backoffice.ledger.repository.CreditApplicationRepository;
import com.backoffice.ledger.repository.CreditRepository;
import com.backoffice.ledger.repository.CustomerRepository;
import com.backoffice.ledger.repository.InvoiceRepository;
import com.backoffice.ledger.util.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class CreditApplicationService {

    private static final Logger logger = LoggerFactory.getLogger(CreditApplicationService.class);

    private final CustomerRepository customerRepository;
    private final CreditRepository creditRepository;
    private final CreditApplicationRepository creditApplicationRepository;
    private final InvoiceRepository invoiceRepository;
    private final LedgerTransactionRunner transactionRunner;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CreditApplicationService(CustomerRepository customerRepository, CreditRepository creditRepository,
            CreditApplicationRepository creditApplicationRepository, InvoiceRepository invoiceRepository,
            LedgerTransactionRunner transactionRunner, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.customerRepository = customerRepository;
        this.creditRepository = creditRepository;
        this.creditApplicationRepository = creditApplicationRepository;
        this.invoiceRepository = invoiceRepository;
        this.transactionRunner = transactionRunner;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Moves part of a customer credit onto one of the same customer's invoices.
     * Every check runs before anything is written, so a rejected call leaves
     * credit and invoice untouched.
     */
    public CreditApplicationResult applyCredit(ApplyCreditRequest request) {
        request.validate();
        BigDecimal amount = MoneyUtils.requirePositive(request.getAmount(), "amount");

        CreditApplicationResult result = transactionRunner.execute("apply-credit", () -> apply(request, amount));

        logger.info("Credit {} applied to invoice {}: {} (credit remaining {}, invoice balance {})",
                result.getCreditId(), result.getInvoiceId(), result.getAmountApplied(),
                result.getCreditRemaining(), result.getInvoiceNewBalance());
        return result;
    }

    private CreditApplicationResult apply(ApplyCreditRequest request, BigDecimal amount) {
        Long customerId = creditRepository.findCustomerIdById(request.getCreditId())
                .orElseThrow(() -> new NotFoundException("Credit", request.getCreditId()));
        customerRepository.findByIdForUpdate(customerId)
                .orElseThrow(() -> new NotFoundException("Customer", customerId));

        Credit credit = creditRepository.findByIdForUpdate(request.getCreditId())
                .orElseThrow(() -> new NotFoundException("Credit", request.getCreditId()));
        Invoice invoice = invoiceRepository.findById(request.getInvoiceId())
                .orElseThrow(() -> new NotFoundException("Invoice", request.getInvoiceId()));

        if (!credit.isActive()) {
            throw new InvalidOperationException("Credit " + credit.getId() + " is not active (status "
                    + credit.getStatus() + ")");
        }
        if (credit.getAvailableAmount().compareTo(amount) < 0) {
            throw new InvalidOperationException("Insufficient credit: credit " + credit.getId() + " has "
                    + credit.getAvailableAmount() + " available, " + amount + " requested");
        }
        if (!invoice.getCustomer().getId().equals(customerId)) {
            throw new InvalidOperationException("Invoice " + invoice.getInvoiceNumber()
                    + " belongs to a different customer than credit " + credit.getId());
        }
        if (InvoiceStatusPolicy.NON_CHARGEABLE.contains(invoice.getStatus())) {
            throw new InvalidOperationException("Invoice " + invoice.getInvoiceNumber() + " is "
                    + invoice.getStatus());
        }
        if (invoice.getBalance() == null) {
            throw new InvalidOperationException("Invoice " + invoice.getInvoiceNumber()
                    + " has no tracked balance; initialize balances first");
        }
        if (invoice.getBalance().signum() == 0) {
            throw new InvalidOperationException("Invoice " + invoice.getInvoiceNumber() + " is already fully paid");
        }
        if (invoice.getBalance().compareTo(amount) < 0) {
            throw new InvalidOperationException("Amount " + amount + " exceeds the balance of invoice "
                    + invoice.getInvoiceNumber() + " (" + invoice.getBalance() + ")");
        }

        Map<String, Object> before = snapshot(credit, invoice);
        LocalDate today = LocalDate.now(clock);

        CreditApplication application = new CreditApplication();
        application.setCredit(credit);
        application.setInvoice(invoice);
        application.setAmountApplied(amount);
        application.setAppliedDate(today);
        application.setAppliedBy(request.getActorId());
        application.setNotes("Credit " + credit.getId() + " applied to invoice " + invoice.getInvoiceNumber());
        creditApplicationRepository.save(application);

        credit.consume(amount);
        creditRepository.save(credit);

        invoice.reduceBalance(amount, today);
        invoiceRepository.save(invoice);

        Map<String, Object> after = snapshot(credit, invoice);
        after.put("creditApplicationId", application.getId());
        eventPublisher.publishEvent(new LedgerAuditEvent(request.getActorId(), LedgerAuditEvent.APPLY_CREDIT,
                "CREDIT_APPLICATION", String.valueOf(application.getId()), before, after));

        return CreditApplicationResult.builder()
                .creditId(credit.getId())
                .invoiceId(invoice.getId())
                .amountApplied(amount)
                .creditRemaining(credit.getAvailableAmount())
                .creditStatus(credit.getStatus())
                .invoiceNewBalance(invoice.getBalance())
                .invoiceStatus(invoice.getStatus())
                .build();
    }

    private Map<String, Object> snapshot(Credit credit, Invoice invoice) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("creditId", credit.getId());
        snapshot.put("creditAvailable", credit.getAvailableAmount());
        snapshot.put("creditStatus", credit.getStatus());
        snapshot.put("invoiceId", invoice.getId());
        snapshot.put("invoiceBalance", invoice.getBalance());
        snapshot.put("invoiceStatus", invoice.getStatus());
        return snapshot;
    }
}
