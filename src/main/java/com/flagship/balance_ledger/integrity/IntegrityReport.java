package com.flagship.balance_ledger.integrity;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Result of one integrity probe.
 *
 * {@code balanced} is the double-entry invariant: all balances sum to 0.00.
 * {@code driftedAccounts} lists accounts whose cached balance no longer matches the
 * balance recomputed from the transactions table. A ledger can be balanced and still
 * drift, e.g. when two balances are off by opposite amounts.
 */
@Value
@Builder
public class IntegrityReport {
    BigDecimal totalBalance;
    boolean balanced;
    List<BalanceDrift> driftedAccounts;
    Instant checkedAt;

    public boolean isHealthy() {
        return balanced && driftedAccounts.isEmpty();
    }
}
