package com.flagship.balance_ledger.ledger;

/**
 * Lifecycle of a single transfer attempt.
 *
 * STARTED → LOCKS_ACQUIRED → WRITES_APPLIED → COMMITTED, or ABORTED from any point.
 * An attempt aborted by a lock conflict is followed by a new STARTED.
 */
public enum TransferState {
    STARTED,
    LOCKS_ACQUIRED,
    WRITES_APPLIED,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }
}
