package com.flagship.balance_ledger.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for transferring funds.
 * Same-account transfers are rejected by the ledger, not here.
 */
@Value
public class CreateTransferRequest {

    @NotNull(message = "From account ID is required")
    Long fromAccountId;

    @NotNull(message = "To account ID is required")
    Long toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 8, fraction = 2, message = "Amount must have at most 8 integer digits and 2 decimal places")
    BigDecimal amount;
}
