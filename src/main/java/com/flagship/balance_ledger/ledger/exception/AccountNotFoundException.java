package com.flagship.balance_ledger.ledger.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends RuntimeException {

    private final long accountId;

    public AccountNotFoundException(long accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }
}
