package com.flagship.balance_ledger.ledger;

import lombok.Value;

/**
 * An account in the ledger. Accounts are created once and never mutated.
 */
@Value
public class Account {
    long accountId;
    String name;
}
