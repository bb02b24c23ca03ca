package com.flagship.balance_ledger.integrity;

import com.flagship.balance_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Probe for the ledger's global invariants.
 *
 * Runs read-only and takes no locks, so it never blocks transfers. Both queries of
 * {@link #verify()} see the same REPEATABLE READ snapshot; transfers in flight are
 * invisible to it until they commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntegrityVerifier {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);

    private static final String DRIFT_QUERY =
        "WITH movements AS ( " +
        "    SELECT credit_account_id AS account_id, amount FROM transactions " +
        "    UNION ALL " +
        "    SELECT debit_account_id AS account_id, -amount FROM transactions " +
        "), expected AS ( " +
        "    SELECT account_id, sum(amount) AS balance FROM movements GROUP BY account_id " +
        ") " +
        "SELECT b.account_id, b.balance AS cached_balance, COALESCE(e.balance, 0) AS expected_balance " +
        "FROM balances b LEFT JOIN expected e ON e.account_id = b.account_id " +
        "WHERE b.balance IS DISTINCT FROM COALESCE(e.balance, 0) " +
        "ORDER BY b.account_id";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics ledgerMetrics;

    /**
     * {@code SELECT sum(balance) FROM balances}; 0.00 for an empty ledger.
     */
    @Transactional(readOnly = true)
    public BigDecimal totalBalance() {
        BigDecimal total = jdbcTemplate.queryForObject("SELECT sum(balance) FROM balances", BigDecimal.class);
        return total != null ? total : ZERO;
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public IntegrityReport verify() {
        BigDecimal total = totalBalance();
        List<BalanceDrift> drifted = jdbcTemplate.query(DRIFT_QUERY, (rs, rowNum) -> new BalanceDrift(
            rs.getLong("account_id"),
            rs.getBigDecimal("cached_balance"),
            rs.getBigDecimal("expected_balance")
        ));

        IntegrityReport report = IntegrityReport.builder()
            .totalBalance(total)
            .balanced(total.compareTo(BigDecimal.ZERO) == 0)
            .driftedAccounts(drifted)
            .checkedAt(Instant.now())
            .build();

        ledgerMetrics.recordIntegrityCheck(report.isHealthy());
        if (report.isHealthy()) {
            log.debug("Integrity check passed: totalBalance={}", total);
        } else {
            log.warn("Integrity check failed: totalBalance={}, driftedAccounts={}", total, drifted);
        }
        return report;
    }

    /**
     * @throws LedgerIntegrityException if the ledger is unbalanced or any balance drifted
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public IntegrityReport assertBalanced() {
        IntegrityReport report = verify();
        if (!report.isHealthy()) {
            throw new LedgerIntegrityException(report);
        }
        return report;
    }
}
