package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.balance_ledger.ledger.exception.InvalidTransferException;
import com.flagship.balance_ledger.ledger.exception.TransferRetriesExhaustedException;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for transferring funds between accounts.
 *
 * This service enforces the core invariants:
 * 1. Every transfer appends one transactions row and moves the same amount out of
 *    one balance and into another, so the sum of all balances stays 0.00
 * 2. The transactions row and both balance writes commit together or not at all
 * 3. Two transfers never read-modify-write the same balance concurrently
 *
 * Balances are a cache of the transactions table, maintained on write and never
 * recomputed on read.
 */
@Service
@Slf4j
public class LedgerService {

    public static final String TRANSFER_ID_MDC_KEY = "transferId";

    private final LedgerRepository ledgerRepository;
    private final TransactionTemplate transactionTemplate;
    private final TransferRetryExecutor retryExecutor;
    private final ObjectProvider<TransferListener> listeners;
    private final LedgerMetrics ledgerMetrics;
    private final LockingStrategy defaultStrategy;

    public LedgerService(LedgerRepository ledgerRepository,
                         @Qualifier("transferTransactionTemplate") TransactionTemplate transactionTemplate,
                         TransferRetryExecutor retryExecutor,
                         ObjectProvider<TransferListener> listeners,
                         LedgerMetrics ledgerMetrics,
                         @Value("${ledger.transfer.locking-strategy:ROW}") LockingStrategy defaultStrategy) {
        this.ledgerRepository = ledgerRepository;
        this.transactionTemplate = transactionTemplate;
        this.retryExecutor = retryExecutor;
        this.listeners = listeners;
        this.ledgerMetrics = ledgerMetrics;
        this.defaultStrategy = defaultStrategy;
    }

    /**
     * Transfers funds using the configured locking strategy.
     *
     * @see #transferFunds(long, long, BigDecimal, LockingStrategy)
     */
    public long transferFunds(long fromAccountId, long toAccountId, BigDecimal amount) {
        return transferFunds(fromAccountId, toAccountId, amount, defaultStrategy);
    }

    /**
     * Moves {@code amount} from one account to another.
     *
     * Runs in its own database transaction, which is re-run from the start when the
     * database aborts it on a deadlock or serialization failure. The call is not
     * idempotent: once it has returned, calling it again transfers again.
     *
     * @param fromAccountId account to debit
     * @param toAccountId account to credit
     * @param amount positive amount with at most two decimal places
     * @param strategy how to serialize against concurrent transfers
     * @return the transaction_id of the recorded transfer
     * @throws InvalidTransferException if the request is rejected before any database work
     * @throws org.springframework.dao.DataIntegrityViolationException if either account does not exist
     * @throws TransferRetriesExhaustedException if every attempt lost a lock conflict
     */
    public long transferFunds(long fromAccountId, long toAccountId, BigDecimal amount, LockingStrategy strategy) {
        long startTime = System.currentTimeMillis();
        MDC.put(TRANSFER_ID_MDC_KEY, UUID.randomUUID().toString().substring(0, 8));

        try {
            TransferRequest request = validate(fromAccountId, toAccountId, amount, strategy);

            log.debug("Transferring funds: from={}, to={}, amount={}, strategy={}",
                    fromAccountId, toAccountId, request.getAmount(), strategy);

            try {
                long transactionId = retryExecutor.execute(strategy, () -> executeTransfer(request, strategy));

                long duration = System.currentTimeMillis() - startTime;
                ledgerMetrics.recordTransfer(strategy, LedgerMetrics.OUTCOME_COMMITTED);
                ledgerMetrics.recordTransferLatency(strategy, duration);

                log.info("Transfer committed: transactionId={}, from={}, to={}, amount={}, duration={}ms",
                        transactionId, fromAccountId, toAccountId, request.getAmount(), duration);

                return transactionId;

            } catch (TransferRetriesExhaustedException e) {
                ledgerMetrics.recordTransfer(strategy, LedgerMetrics.OUTCOME_EXHAUSTED);
                ledgerMetrics.recordTransferLatency(strategy, System.currentTimeMillis() - startTime);
                log.error("Transfer gave up: from={}, to={}, attempts={}", fromAccountId, toAccountId, e.getAttempts());
                throw e;
            } catch (RuntimeException e) {
                ledgerMetrics.recordTransfer(strategy, LedgerMetrics.OUTCOME_FAILED);
                ledgerMetrics.recordTransferLatency(strategy, System.currentTimeMillis() - startTime);
                log.error("Transfer failed: from={}, to={}, error={}", fromAccountId, toAccountId, e.getMessage());
                throw e;
            }
        } finally {
            MDC.remove(TRANSFER_ID_MDC_KEY);
        }
    }

    /**
     * Reads an account's balance from the balances cache.
     *
     * @throws AccountNotFoundException if the account has no balance row
     */
    @Transactional(readOnly = true)
    public BigDecimal getBalance(long accountId) {
        return ledgerRepository.findBalance(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Gets every transfer debiting or crediting an account, oldest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactionsForAccount(long accountId) {
        return ledgerRepository.findTransactionsForAccount(accountId);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> getTransaction(long transactionId) {
        return ledgerRepository.findTransaction(transactionId);
    }

    private TransferRequest validate(long fromAccountId, long toAccountId, BigDecimal amount,
                                     LockingStrategy strategy) {
        if (strategy == null) {
            throw new InvalidTransferException("Locking strategy is required");
        }
        try {
            return TransferRequest.of(fromAccountId, toAccountId, amount);
        } catch (InvalidTransferException e) {
            ledgerMetrics.recordTransfer(strategy, LedgerMetrics.OUTCOME_REJECTED);
            log.warn("Transfer rejected: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * One attempt: a single database transaction from STARTED to COMMITTED or ABORTED.
     */
    private long executeTransfer(TransferRequest request, LockingStrategy strategy) {
        notifyState(TransferState.STARTED, request);
        Long transactionId;
        try {
            transactionId = transactionTemplate.execute(status -> applyTransfer(request, strategy));
        } catch (RuntimeException e) {
            notifyAborted(request, e);
            throw e;
        }
        if (transactionId == null) {
            throw new IllegalStateException("Transfer transaction completed without a transaction_id");
        }
        notifyCommitted(request, transactionId);
        return transactionId;
    }

    private long applyTransfer(TransferRequest request, LockingStrategy strategy) {
        long debitAccountId = request.getFromAccountId();
        long creditAccountId = request.getToAccountId();

        // Lock, then read. The reads below see the latest committed balances and
        // nobody else can change them until this transaction ends.
        Optional<BigDecimal> debitBalance;
        Optional<BigDecimal> creditBalance;
        switch (strategy) {
            case TABLE -> {
                ledgerRepository.lockBalanceTable();
                debitBalance = ledgerRepository.findBalance(debitAccountId);
                creditBalance = ledgerRepository.findBalance(creditAccountId);
            }
            case ROW -> {
                debitBalance = ledgerRepository.lockBalance(debitAccountId);
                afterStep(TransferStep.DEBIT_ROW_LOCKED, request);
                creditBalance = ledgerRepository.lockBalance(creditAccountId);
            }
            default -> throw new IllegalArgumentException("Unsupported locking strategy: " + strategy);
        }
        log.debug("Locks acquired: strategy={}, debitBalance={}, creditBalance={}",
                strategy, debitBalance.orElse(null), creditBalance.orElse(null));
        afterStep(TransferStep.LOCKS_ACQUIRED, request);
        notifyState(TransferState.LOCKS_ACQUIRED, request);

        // Foreign keys reject unknown accounts here, before any balance is written
        long transactionId = ledgerRepository.insertTransaction(debitAccountId, creditAccountId, request.getAmount());
        afterStep(TransferStep.TRANSACTION_RECORDED, request);

        BigDecimal newDebitBalance = currentBalance(debitAccountId, debitBalance).subtract(request.getAmount());
        writeBalance(debitAccountId, newDebitBalance);
        afterStep(TransferStep.DEBIT_APPLIED, request);

        BigDecimal newCreditBalance = currentBalance(creditAccountId, creditBalance).add(request.getAmount());
        writeBalance(creditAccountId, newCreditBalance);
        afterStep(TransferStep.CREDIT_APPLIED, request);

        notifyState(TransferState.WRITES_APPLIED, request);
        return transactionId;
    }

    private BigDecimal currentBalance(long accountId, Optional<BigDecimal> balance) {
        return balance.orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private void writeBalance(long accountId, BigDecimal balance) {
        int updated = ledgerRepository.updateBalance(accountId, balance);
        if (updated != 1) {
            throw new IllegalStateException(
                String.format("Expected to update 1 balance row for account %d, updated %d", accountId, updated));
        }
    }

    private void afterStep(TransferStep step, TransferRequest request) {
        listeners.orderedStream().forEach(listener -> listener.afterStep(step, request));
    }

    private void notifyState(TransferState state, TransferRequest request) {
        listeners.orderedStream().forEach(listener -> listener.onStateChange(state, request));
    }

    /**
     * The transfer is durable at this point. A listener failure is logged and must not
     * reach the caller or the retry policy, which would report or apply it twice.
     */
    private void notifyCommitted(TransferRequest request, long transactionId) {
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onStateChange(TransferState.COMMITTED, request);
            } catch (RuntimeException e) {
                log.error("Listener {} failed after commit: transactionId={}",
                        listener.getClass().getName(), transactionId, e);
            }
        });
    }

    private void notifyAborted(TransferRequest request, RuntimeException cause) {
        try {
            notifyState(TransferState.ABORTED, request);
        } catch (RuntimeException listenerFailure) {
            cause.addSuppressed(listenerFailure);
        }
    }
}
