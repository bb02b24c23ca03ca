package com.flagship.balance_ledger.ledger;

/**
 * Callback for observing transfers as they execute.
 *
 * Callbacks run on the caller's thread. {@link #afterStep} and the LOCKS_ACQUIRED and
 * WRITES_APPLIED state changes run inside the open database transaction: throwing
 * from them aborts the attempt and rolls back everything written so far. The
 * COMMITTED notification runs after the commit; a failure there is logged only.
 */
public interface TransferListener {

    default void onStateChange(TransferState state, TransferRequest request) {
    }

    default void afterStep(TransferStep step, TransferRequest request) {
    }
}
