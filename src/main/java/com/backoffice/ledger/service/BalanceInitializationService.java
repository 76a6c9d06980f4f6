package com.backoffice.ledger.service;

import com.backoffice.ledger.dto.BalanceInitializationResult;
import com.backoffice.ledger.model.Invoice;
import com.backoffice.ledger.model.InvoiceStatus;
import com.backoffice.ledger.model.InvoiceStatusPolicy;
import com.backoffice.ledger.repository.CreditApplicationRepository;
import com.backoffice.ledger.repository.InvoiceRepository;
import com.backoffice.ledger.repository.PaymentApplicationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-off repair for invoices created before balances were tracked, or whose
 * stored balance drifted from their applications. Safe to run repeatedly.
 */
@Service
public class BalanceInitializationService {

    private static final Logger logger = LoggerFactory.getLogger(BalanceInitializationService.class);

    private final InvoiceRepository invoiceRepository;
    private final PaymentApplicationRepository paymentApplicationRepository;
    private final CreditApplicationRepository creditApplicationRepository;
    private final LedgerTransactionRunner transactionRunner;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BalanceInitializationService(InvoiceRepository invoiceRepository,
            PaymentApplicationRepository paymentApplicationRepository,
            CreditApplicationRepository creditApplicationRepository, LedgerTransactionRunner transactionRunner,
            ApplicationEventPublisher eventPublisher, Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.paymentApplicationRepository = paymentApplicationRepository;
        this.creditApplicationRepository = creditApplicationRepository;
        this.transactionRunner = transactionRunner;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public BalanceInitializationResult initializeBalances(String actorId) {
        BalanceInitializationResult result = transactionRunner.execute("initialize-balances",
                () -> recompute(actorId));
        logger.info("Invoice balance initialization by {}: {} updated, {} skipped", actorId,
                result.getUpdatedCount(), result.getSkippedInvoiceIds().size());
        return result;
    }

    private BalanceInitializationResult recompute(String actorId) {
        Map<Long, BigDecimal> applied = new HashMap<>();
        addGrouped(applied, paymentApplicationRepository.sumAmountAppliedGroupedByInvoice());
        addGrouped(applied, creditApplicationRepository.sumAmountAppliedGroupedByInvoice());

        LocalDate today = LocalDate.now(clock);
        int updated = 0;
        List<Long> skipped = new ArrayList<>();

        for (Invoice invoice : invoiceRepository.findAll()) {
            BigDecimal expected = invoice.getTotalAmount()
                    .subtract(applied.getOrDefault(invoice.getId(), BigDecimal.ZERO));
            if (expected.signum() < 0) {
                logger.warn("Invoice {} has more applied ({}) than its total ({}); left unchanged",
                        invoice.getInvoiceNumber(), invoice.getTotalAmount().subtract(expected),
                        invoice.getTotalAmount());
                skipped.add(invoice.getId());
                continue;
            }

            InvoiceStatus derived = InvoiceStatusPolicy.derive(invoice.getStatus(), expected,
                    invoice.getTotalAmount(), invoice.getDueDate(), today);
            boolean staleBalance = invoice.getBalance() == null || invoice.getBalance().compareTo(expected) != 0;
            if (staleBalance || derived != invoice.getStatus()) {
                logger.debug("Invoice {}: balance {} -> {}, status {} -> {}", invoice.getInvoiceNumber(),
                        invoice.getBalance(), expected, invoice.getStatus(), derived);
                invoice.setBalance(expected);
                invoice.setStatus(derived);
                invoiceRepository.save(invoice);
                updated++;
            }
        }

        if (updated > 0 || !skipped.isEmpty()) {
            Map<String, Object> after = new LinkedHashMap<>();
            after.put("updatedCount", updated);
            after.put("skippedInvoiceIds", skipped);
            eventPublisher.publishEvent(new LedgerAuditEvent(actorId, LedgerAuditEvent.INITIALIZE_BALANCES,
                    "INVOICE", "*", null, after));
        }
        return new BalanceInitializationResult(updated, skipped);
    }

    private static void addGrouped(Map<Long, BigDecimal> totals, List<Object[]> rows) {
        for (Object[] row : rows) {
            Long invoiceId = (Long) row[0];
            BigDecimal amount = (BigDecimal) row[1];
            if (amount != null) {
                totals.merge(invoiceId, amount, BigDecimal::add);
            }
        }
    }
}
