package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.ledger.exception.TransferRetriesExhaustedException;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a unit of work, re-running it from scratch when it loses a lock conflict.
 *
 * The unit of work must open and finish its own database transaction, so that each
 * attempt starts with no locks held and nothing written. Only
 * {@link PessimisticLockingFailureException} is retried: the database has rolled the
 * attempt back, so running it again cannot apply it twice. Any other failure
 * propagates on the first occurrence.
 */
@Component
@Slf4j
public class TransferRetryExecutor {

    private final RetryTemplate retryTemplate;
    private final LedgerMetrics ledgerMetrics;
    private final int maxAttempts;

    public TransferRetryExecutor(@Qualifier("transferRetryTemplate") RetryTemplate retryTemplate,
                                 LedgerMetrics ledgerMetrics,
                                 @Value("${ledger.transfer.retry.max-attempts:10}") int maxAttempts) {
        this.retryTemplate = retryTemplate;
        this.ledgerMetrics = ledgerMetrics;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws TransferRetriesExhaustedException if every attempt lost a lock conflict
     */
    public <T> T execute(LockingStrategy strategy, Supplier<T> unitOfWork) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    ledgerMetrics.recordRetry(strategy);
                    log.warn("Retrying after lock conflict: attempt={}/{}, cause={}",
                            context.getRetryCount() + 1, maxAttempts,
                            context.getLastThrowable() != null ? context.getLastThrowable().getMessage() : "unknown");
                }
                return unitOfWork.get();
            });
        } catch (PessimisticLockingFailureException e) {
            throw new TransferRetriesExhaustedException(maxAttempts, e);
        }
    }
}
