package com.flagship.balance_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * SQL against the accounts, transactions and balances tables.
 *
 * No method opens a transaction of its own; callers decide the unit of work.
 * Locking reads only hold their locks when called inside a transaction.
 */
@Repository
public class LedgerRepository {

    private final JdbcTemplate jdbcTemplate;

    public LedgerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    // ==================== Accounts ====================

    public long insertAccount(String name) {
        Long accountId = jdbcTemplate.queryForObject(
            "INSERT INTO accounts (name) VALUES (?) RETURNING account_id",
            Long.class,
            name
        );
        if (accountId == null) {
            throw new IllegalStateException("Database returned no account_id for inserted account");
        }
        return accountId;
    }

    public Optional<Account> findAccount(long accountId) {
        return jdbcTemplate.query(
            "SELECT account_id, name FROM accounts WHERE account_id = ?",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    public List<Long> findAllAccountIds() {
        return jdbcTemplate.queryForList("SELECT account_id FROM accounts ORDER BY account_id", Long.class);
    }

    // ==================== Balances ====================

    public void insertBalance(long accountId, BigDecimal balance) {
        jdbcTemplate.update(
            "INSERT INTO balances (account_id, balance) VALUES (?, ?)",
            accountId,
            balance
        );
    }

    /**
     * Exclusive lock on the whole balances table until the transaction ends.
     * Plain reads stay allowed; every other writer or locking reader waits.
     */
    public void lockBalanceTable() {
        jdbcTemplate.execute("LOCK TABLE balances IN EXCLUSIVE MODE");
    }

    /**
     * Reads a balance and row-locks it until the transaction ends.
     * Empty when the account has no balance row; nothing is locked then.
     */
    public Optional<BigDecimal> lockBalance(long accountId) {
        return singleBalance(accountId, jdbcTemplate.query(
            "SELECT balance FROM balances WHERE account_id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getBigDecimal("balance"),
            accountId
        ));
    }

    public Optional<BigDecimal> findBalance(long accountId) {
        return singleBalance(accountId, jdbcTemplate.query(
            "SELECT balance FROM balances WHERE account_id = ?",
            (rs, rowNum) -> rs.getBigDecimal("balance"),
            accountId
        ));
    }

    public int updateBalance(long accountId, BigDecimal balance) {
        return jdbcTemplate.update(
            "UPDATE balances SET balance = ? WHERE account_id = ?",
            balance,
            accountId
        );
    }

    // ==================== Transactions ====================

    public long insertTransaction(long debitAccountId, long creditAccountId, BigDecimal amount) {
        Long transactionId = jdbcTemplate.queryForObject(
            "INSERT INTO transactions (debit_account_id, credit_account_id, amount) " +
            "VALUES (?, ?, ?) RETURNING transaction_id",
            Long.class,
            debitAccountId,
            creditAccountId,
            amount
        );
        if (transactionId == null) {
            throw new IllegalStateException("Database returned no transaction_id for inserted transaction");
        }
        return transactionId;
    }

    public Optional<LedgerTransaction> findTransaction(long transactionId) {
        return jdbcTemplate.query(
            "SELECT transaction_id, debit_account_id, credit_account_id, amount " +
            "FROM transactions WHERE transaction_id = ?",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    public List<LedgerTransaction> findTransactionsForAccount(long accountId) {
        return jdbcTemplate.query(
            "SELECT transaction_id, debit_account_id, credit_account_id, amount " +
            "FROM transactions WHERE debit_account_id = ? OR credit_account_id = ? " +
            "ORDER BY transaction_id",
            transactionRowMapper(),
            accountId,
            accountId
        );
    }

    private Optional<BigDecimal> singleBalance(long accountId, List<BigDecimal> rows) {
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal balance = rows.get(0);
        if (balance == null) {
            throw new IllegalStateException("Balance row for account " + accountId + " holds no value");
        }
        return Optional.of(balance);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("account_id"),
            rs.getString("name")
        );
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getLong("transaction_id"),
            rs.getLong("debit_account_id"),
            rs.getLong("credit_account_id"),
            rs.getBigDecimal("amount")
        );
    }
}
