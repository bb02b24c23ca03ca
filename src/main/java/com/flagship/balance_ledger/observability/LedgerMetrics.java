package com.flagship.balance_ledger.observability;

import com.flagship.balance_ledger.ledger.LockingStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.accounts.created: Counter of created accounts
 * - ledger.transfers: Counter of transfers, tagged by strategy and outcome
 * - ledger.transfer.retries: Counter of attempts aborted by a lock conflict and retried
 * - ledger.transfer.duration: Timer of transfer calls, retries included
 * - ledger.integrity.checks: Counter of integrity probes, tagged by result
 */
@Component
public class LedgerMetrics {

    public static final String OUTCOME_COMMITTED = "committed";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_EXHAUSTED = "exhausted";

    private final MeterRegistry registry;

    private final Counter accountsCreated;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsCreated = Counter.builder("ledger.accounts.created")
                .description("Number of accounts created")
                .register(registry);
    }

    public void incrementAccountsCreated() {
        accountsCreated.increment();
    }

    /**
     * Records the final outcome of a transfer call.
     */
    public void recordTransfer(LockingStrategy strategy, String outcome) {
        registry.counter("ledger.transfers",
                "strategy", strategyTag(strategy),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordRetry(LockingStrategy strategy) {
        registry.counter("ledger.transfer.retries", "strategy", strategyTag(strategy)).increment();
    }

    public void recordTransferLatency(LockingStrategy strategy, long durationMs) {
        registry.timer("ledger.transfer.duration",
                "strategy", strategyTag(strategy)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIntegrityCheck(boolean healthy) {
        registry.counter("ledger.integrity.checks", "result", healthy ? "pass" : "fail").increment();
    }

    public double retryCount(LockingStrategy strategy) {
        return registry.counter("ledger.transfer.retries", "strategy", strategyTag(strategy)).count();
    }

    private String strategyTag(LockingStrategy strategy) {
        return strategy == null ? "unknown" : strategy.name().toLowerCase();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
