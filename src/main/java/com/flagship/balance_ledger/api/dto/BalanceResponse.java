package com.flagship.balance_ledger.api.dto;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {
    long accountId;
    BigDecimal balance;
}
