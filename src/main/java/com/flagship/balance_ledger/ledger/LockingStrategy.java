package com.flagship.balance_ledger.ledger;

/**
 * How a transfer serializes against other transfers touching the same balances.
 */
public enum LockingStrategy {

    /**
     * {@code LOCK TABLE balances IN EXCLUSIVE MODE}: every transfer waits for every
     * other one, whichever accounts they touch. Never deadlocks.
     */
    TABLE,

    /**
     * {@code SELECT ... FOR UPDATE} on the two balance rows, debit account first.
     * Transfers over disjoint accounts run in parallel; transfers locking the same
     * pair in opposite order can deadlock and are retried.
     */
    ROW
}
