package com.flagship.balance_ledger.ledger.exception;

import lombok.Getter;

/**
 * Every attempt of a transfer lost a lock conflict (deadlock or serialization
 * failure). None of the attempts committed, so the caller may safely retry.
 */
@Getter
public class TransferRetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public TransferRetriesExhaustedException(int attempts, Throwable lastFailure) {
        super(String.format("Transfer aborted after %d attempts on lock conflicts: %s",
            attempts, lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }
}
