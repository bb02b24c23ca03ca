package com.flagship.balance_ledger.integrity;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the ledger invariants.
 * Down when balances do not sum to zero or a cached balance drifted from its transactions.
 */
@Component("ledgerIntegrity")
public class LedgerIntegrityHealthIndicator implements HealthIndicator {

    private final IntegrityVerifier integrityVerifier;

    public LedgerIntegrityHealthIndicator(IntegrityVerifier integrityVerifier) {
        this.integrityVerifier = integrityVerifier;
    }

    @Override
    public Health health() {
        try {
            IntegrityReport report = integrityVerifier.verify();

            Health.Builder builder = report.isHealthy() ? Health.up() : Health.down();

            return builder
                    .withDetail("totalBalance", report.getTotalBalance())
                    .withDetail("balanced", report.isBalanced())
                    .withDetail("driftedAccounts", report.getDriftedAccounts().size())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
