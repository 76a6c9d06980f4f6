package com.backoffice.ledger.service;

import com.backoffice.ledger.config.LedgerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a balance-mutating unit of work in its own transaction, retrying the
 * whole transaction when it loses a row-lock or version race. Every attempt
 * starts from a clean persistence context and re-reads current state.
 * <p>
 * A conflict that survives every attempt propagates as the original
 * {@link ConcurrencyFailureException}. Any other failure is not retried.
 */
@Component
public class LedgerTransactionRunner {

    private static final Logger logger = LoggerFactory.getLogger(LedgerTransactionRunner.class);

    private final TransactionTemplate txTemplate;
    private final RetryTemplate retryTemplate;

    public LedgerTransactionRunner(PlatformTransactionManager txManager, LedgerProperties properties) {
        this.txTemplate = new TransactionTemplate(txManager);
        LedgerProperties.Retry retry = properties.getRetry();
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .exponentialBackoff(retry.getBackoffMs(), 2.0, retry.getMaxBackoffMs())
                .retryOn(ConcurrencyFailureException.class)
                .traversingCauses()
                .build();
    }

    public <T> T execute(String operation, Supplier<T> work) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                logger.warn("Retrying {} after concurrent modification (attempt {}): {}", operation,
                        context.getRetryCount() + 1, context.getLastThrowable().getMessage());
            }
            return txTemplate.execute(status -> work.get());
        });
    }
}
