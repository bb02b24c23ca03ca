package com.flagship.balance_ledger.ledger.exception;

/**
 * An account creation request was rejected before touching the database.
 */
public class InvalidAccountException extends IllegalArgumentException {

    public InvalidAccountException(String message) {
        super(message);
    }
}
