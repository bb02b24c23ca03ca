package com.flagship.balance_ledger.ledger;

/**
 * Steps executed inside the database transaction of a transfer, in order.
 */
public enum TransferStep {
    /** Only reached with {@link LockingStrategy#ROW}, between the two row locks. */
    DEBIT_ROW_LOCKED,
    LOCKS_ACQUIRED,
    TRANSACTION_RECORDED,
    DEBIT_APPLIED,
    CREDIT_APPLIED
}
