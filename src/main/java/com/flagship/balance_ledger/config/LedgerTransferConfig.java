package com.flagship.balance_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction and retry settings for transfers.
 *
 * A transfer is one READ COMMITTED transaction. Lost updates are prevented by the
 * locks it takes, not by the isolation level, so a lock conflict is the only
 * transient failure: PostgreSQL deadlocks (40P01), serialization failures (40001)
 * and lock-not-available (55P03), all translated by Spring into
 * {@link PessimisticLockingFailureException}.
 */
@Configuration
public class LedgerTransferConfig {

    @Bean
    public TransactionTemplate transferTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setName("transferFunds");
        return template;
    }

    /**
     * Retries a whole transfer on lock conflicts with jittered exponential backoff.
     * Jitter keeps two deadlock victims from colliding again on the same schedule.
     */
    @Bean
    public RetryTemplate transferRetryTemplate(
            @Value("${ledger.transfer.retry.max-attempts:10}") int maxAttempts,
            @Value("${ledger.transfer.retry.initial-backoff-ms:10}") long initialBackoffMs,
            @Value("${ledger.transfer.retry.multiplier:2.0}") double multiplier,
            @Value("${ledger.transfer.retry.max-backoff-ms:1000}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, multiplier, maxBackoffMs, true)
                .retryOn(PessimisticLockingFailureException.class)
                .build();
    }
}
