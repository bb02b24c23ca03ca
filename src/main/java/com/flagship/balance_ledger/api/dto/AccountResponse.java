package com.flagship.balance_ledger.api.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class AccountResponse {
    long accountId;
    String name;
    BigDecimal balance;
}
