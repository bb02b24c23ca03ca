package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.ledger.exception.InvalidTransferException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A validated request to move {@code amount} from one account to another.
 *
 * Invariants: the accounts differ, the amount is positive and carries at most two
 * decimal places. Whether the accounts exist is left to the database.
 */
@Value
public class TransferRequest {

    private static final int AMOUNT_SCALE = 2;

    long fromAccountId;
    long toAccountId;
    BigDecimal amount;

    private TransferRequest(long fromAccountId, long toAccountId, BigDecimal amount) {
        this.fromAccountId = fromAccountId;
        this.toAccountId = toAccountId;
        this.amount = amount;
    }

    public static TransferRequest of(long fromAccountId, long toAccountId, BigDecimal amount) {
        if (amount == null) {
            throw new InvalidTransferException("Amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidTransferException("Amount must be positive: " + amount.toPlainString());
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new InvalidTransferException(
                String.format("Amount %s has more than %d decimal places", amount.toPlainString(), AMOUNT_SCALE));
        }
        if (fromAccountId == toAccountId) {
            throw new InvalidTransferException("Cannot transfer from account " + fromAccountId + " to itself");
        }
        return new TransferRequest(fromAccountId, toAccountId, amount.setScale(AMOUNT_SCALE, RoundingMode.UNNECESSARY));
    }
}
