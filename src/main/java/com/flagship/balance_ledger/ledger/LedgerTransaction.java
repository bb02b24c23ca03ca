package com.flagship.balance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A committed transfer as recorded in the append-only transactions table.
 *
 * The transactions table is the system of record; the balances table is a
 * projection of it maintained in the same database transaction.
 */
@Value
public class LedgerTransaction {
    long transactionId;
    long debitAccountId;
    long creditAccountId;
    BigDecimal amount;

    public boolean involves(long accountId) {
        return debitAccountId == accountId || creditAccountId == accountId;
    }
}
