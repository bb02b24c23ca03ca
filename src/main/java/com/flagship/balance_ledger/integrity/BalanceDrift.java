package com.flagship.balance_ledger.integrity;

import lombok.Value;

import java.math.BigDecimal;

/**
 * An account whose cached balance disagrees with its transactions.
 * {@code cachedBalance} is null when the balance row holds no value.
 */
@Value
public class BalanceDrift {
    long accountId;
    BigDecimal cachedBalance;
    BigDecimal expectedBalance;
}
