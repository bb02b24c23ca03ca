package com.flagship.balance_ledger.api.dto;

import com.flagship.balance_ledger.ledger.LedgerTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO for a recorded transfer.
 */
@Value
@Builder
public class TransactionResponse {
    long transactionId;
    long fromAccountId;
    long toAccountId;
    BigDecimal amount;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .transactionId(transaction.getTransactionId())
            .fromAccountId(transaction.getDebitAccountId())
            .toAccountId(transaction.getCreditAccountId())
            .amount(transaction.getAmount())
            .build();
    }
}
