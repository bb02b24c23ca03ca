package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.config.LedgerTransferConfig;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Listener failures after the commit must not undo, repeat or fail the transfer.
 * Runs without a database: the repository is mocked and the transaction manager only
 * counts commits.
 */
class TransferCommitNotificationTest {

    private LedgerRepository ledgerRepository;
    private CountingTransactionManager transactionManager;
    private List<TransferState> states;
    private DefaultListableBeanFactory beanFactory;

    @BeforeEach
    void setUp() {
        ledgerRepository = mock(LedgerRepository.class);
        when(ledgerRepository.lockBalance(anyLong())).thenReturn(Optional.of(new BigDecimal("0.00")));
        when(ledgerRepository.insertTransaction(anyLong(), anyLong(), any())).thenReturn(1L);
        when(ledgerRepository.updateBalance(anyLong(), any())).thenReturn(1);

        transactionManager = new CountingTransactionManager();
        states = new CopyOnWriteArrayList<>();
        beanFactory = new DefaultListableBeanFactory();
    }

    @Test
    @DisplayName("A lock conflict thrown by a COMMITTED listener neither retries nor aborts the transfer")
    void lockConflictAfterCommitIsNotRetried() {
        // Given: a listener that fails once it sees the commit
        AtomicInteger commitNotifications = new AtomicInteger();
        beanFactory.registerSingleton("failingListener", new TransferListener() {
            @Override
            public void onStateChange(TransferState state, TransferRequest request) {
                states.add(state);
                if (state == TransferState.COMMITTED && commitNotifications.incrementAndGet() == 1) {
                    throw new CannotAcquireLockException("listener failure");
                }
            }
        });

        // When
        long transactionId = ledgerService().transferFunds(1L, 2L, new BigDecimal("10.00"), LockingStrategy.ROW);

        // Then
        assertEquals(1L, transactionId);
        assertEquals(1, transactionManager.commits.get());
        verify(ledgerRepository, times(1)).insertTransaction(1L, 2L, new BigDecimal("10.00"));
        assertEquals(
            List.of(TransferState.STARTED, TransferState.LOCKS_ACQUIRED,
                    TransferState.WRITES_APPLIED, TransferState.COMMITTED),
            states);
        assertTrue(states.get(states.size() - 1).isTerminal());
    }

    @Test
    @DisplayName("Other listeners still see COMMITTED when an earlier one fails")
    void remainingListenersAreNotified() {
        beanFactory.registerSingleton("failingListener", new TransferListener() {
            @Override
            public void onStateChange(TransferState state, TransferRequest request) {
                if (state == TransferState.COMMITTED) {
                    throw new IllegalStateException("listener failure");
                }
            }
        });
        beanFactory.registerSingleton("recordingListener", new TransferListener() {
            @Override
            public void onStateChange(TransferState state, TransferRequest request) {
                states.add(state);
            }
        });

        ledgerService().transferFunds(1L, 2L, new BigDecimal("10.00"), LockingStrategy.ROW);

        assertEquals(1, transactionManager.commits.get());
        assertTrue(states.contains(TransferState.COMMITTED));
        assertFalse(states.contains(TransferState.ABORTED));
    }

    private LedgerService ledgerService() {
        LedgerTransferConfig config = new LedgerTransferConfig();
        LedgerMetrics metrics = new LedgerMetrics(new SimpleMeterRegistry());
        TransferRetryExecutor retryExecutor = new TransferRetryExecutor(
            config.transferRetryTemplate(3, 1, 2.0, 5), metrics, 3);

        return new LedgerService(
            ledgerRepository,
            config.transferTransactionTemplate(transactionManager),
            retryExecutor,
            beanFactory.getBeanProvider(TransferListener.class),
            metrics,
            LockingStrategy.ROW
        );
    }

    private static class CountingTransactionManager extends AbstractPlatformTransactionManager {

        private final AtomicInteger commits = new AtomicInteger();

        @Override
        protected Object doGetTransaction() {
            return new Object();
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {
        }

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
            commits.incrementAndGet();
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {
        }
    }
}
