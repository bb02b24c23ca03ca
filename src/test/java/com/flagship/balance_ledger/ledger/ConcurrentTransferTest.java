package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.AbstractLedgerIntegrationTest;
import com.flagship.balance_ledger.integrity.IntegrityReport;
import com.flagship.balance_ledger.integrity.IntegrityVerifier;
import com.flagship.balance_ledger.ledger.exception.TransferRetriesExhaustedException;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent transfers against shared accounts.
 *
 * Without locking, two transfers reading the same balance would lose one update.
 * These tests check that no update is lost and that deadlocks are retried away.
 */
class ConcurrentTransferTest extends AbstractLedgerIntegrationTest {

    private static final int THREADS = 8;
    private static final int TRANSFERS_PER_THREAD = 25;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private IntegrityVerifier integrityVerifier;

    @Autowired
    private LedgerMetrics ledgerMetrics;

    @ParameterizedTest
    @EnumSource(LockingStrategy.class)
    @DisplayName("Concurrent transfers out of one account lose no update")
    void concurrentTransfersLoseNoUpdate(LockingStrategy strategy) throws InterruptedException {
        // Given
        long source = accountService.createAccount("source");
        long target = accountService.createAccount("target");

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREADS);
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

        // When
        for (int i = 0; i < THREADS; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < TRANSFERS_PER_THREAD; j++) {
                        ledgerService.transferFunds(source, target, new BigDecimal("1.00"), strategy);
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "Transfers did not finish in time");
        executor.shutdown();

        // Then
        assertTrue(failures.isEmpty(), () -> "Unexpected failures: " + failures);
        BigDecimal moved = new BigDecimal(THREADS * TRANSFERS_PER_THREAD).setScale(2);
        assertEquals(moved.negate(), balanceOf(source));
        assertEquals(moved, balanceOf(target));
        assertEquals(THREADS * TRANSFERS_PER_THREAD, transactionCount());
        assertTrue(integrityVerifier.verify().isHealthy());
    }

    @Test
    @DisplayName("Opposite transfers that deadlock under row locking both commit after a retry")
    void deadlockIsRetried() throws Exception {
        // Given: both transfers hold their debit row lock before either asks for the credit row
        long alice = accountService.createAccount("alice");
        long bob = accountService.createAccount("bob");
        double retriesBefore = ledgerMetrics.retryCount(LockingStrategy.ROW);

        CyclicBarrier barrier = new CyclicBarrier(2);
        AtomicInteger arrivals = new AtomicInteger();
        transferListener.onStep((step, request) -> {
            if (step == TransferStep.DEBIT_ROW_LOCKED && arrivals.incrementAndGet() <= 2) {
                try {
                    barrier.await(10, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("Barrier failed", e);
                }
            }
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);

        // When
        var aliceToBob = executor.submit(
            () -> ledgerService.transferFunds(alice, bob, new BigDecimal("10.00"), LockingStrategy.ROW));
        var bobToAlice = executor.submit(
            () -> ledgerService.transferFunds(bob, alice, new BigDecimal("4.00"), LockingStrategy.ROW));

        aliceToBob.get(30, TimeUnit.SECONDS);
        bobToAlice.get(30, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertEquals(new BigDecimal("-6.00"), balanceOf(alice));
        assertEquals(new BigDecimal("6.00"), balanceOf(bob));
        assertEquals(2, transactionCount());
        assertTrue(transferListener.states().contains(TransferState.ABORTED), "One transfer should have been aborted");
        assertTrue(ledgerMetrics.retryCount(LockingStrategy.ROW) >= retriesBefore + 1);
    }

    @Test
    @DisplayName("Random transfers across few accounts keep every invariant")
    void randomTransfersKeepInvariants() throws InterruptedException {
        // Given
        List<Long> accounts = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            accounts.add(accountService.createAccount("account-" + i));
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch doneLatch = new CountDownLatch(THREADS);
        AtomicInteger committed = new AtomicInteger();
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

        // When
        for (int i = 0; i < THREADS; i++) {
            executor.submit(() -> {
                ThreadLocalRandom random = ThreadLocalRandom.current();
                try {
                    for (int j = 0; j < TRANSFERS_PER_THREAD; j++) {
                        int from = random.nextInt(accounts.size());
                        int to = (from + 1 + random.nextInt(accounts.size() - 1)) % accounts.size();
                        BigDecimal amount = BigDecimal.valueOf(random.nextInt(1, 10_000), 2);
                        LockingStrategy strategy = random.nextBoolean() ? LockingStrategy.ROW : LockingStrategy.TABLE;
                        try {
                            ledgerService.transferFunds(accounts.get(from), accounts.get(to), amount, strategy);
                            committed.incrementAndGet();
                        } catch (TransferRetriesExhaustedException e) {
                            // gave up under contention with nothing applied
                        }
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        assertTrue(doneLatch.await(120, TimeUnit.SECONDS), "Transfers did not finish in time");
        executor.shutdown();

        // Then
        assertTrue(failures.isEmpty(), () -> "Unexpected failures: " + failures);
        IntegrityReport report = integrityVerifier.verify();
        assertTrue(report.isBalanced(), () -> "Total balance is " + report.getTotalBalance());
        assertTrue(report.getDriftedAccounts().isEmpty(), () -> "Drifted: " + report.getDriftedAccounts());
        assertEquals(committed.get(), transactionCount());
    }
}
