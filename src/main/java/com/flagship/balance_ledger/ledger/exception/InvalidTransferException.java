package com.flagship.balance_ledger.ledger.exception;

/**
 * A transfer was rejected before touching the database.
 */
public class InvalidTransferException extends IllegalArgumentException {

    public InvalidTransferException(String message) {
        super(message);
    }
}
