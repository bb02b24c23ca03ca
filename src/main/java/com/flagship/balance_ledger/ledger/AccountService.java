package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.ledger.exception.InvalidAccountException;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Service for managing accounts.
 *
 * An account and its balance row are created together: no account exists without a
 * balance row and no balance row without an account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final LedgerRepository ledgerRepository;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Creates an account with a zero balance.
     *
     * A {@code null} name is left for the NOT NULL constraint to reject.
     *
     * @param name display name, not necessarily unique
     * @return the generated account_id
     * @throws InvalidAccountException if the name is empty or blank
     * @throws org.springframework.dao.DataIntegrityViolationException if the database rejects the insert
     */
    @Transactional
    public long createAccount(String name) {
        if (name != null && name.isBlank()) {
            throw new InvalidAccountException("Account name must not be blank");
        }

        long accountId = ledgerRepository.insertAccount(name);
        ledgerRepository.insertBalance(accountId, BigDecimal.ZERO);

        ledgerMetrics.incrementAccountsCreated();
        log.info("Created account: accountId={}, name={}", accountId, name);
        return accountId;
    }

    @Transactional(readOnly = true)
    public Optional<Account> findAccount(long accountId) {
        return ledgerRepository.findAccount(accountId);
    }

    /**
     * Gets the ids of all accounts in ascending order.
     */
    @Transactional(readOnly = true)
    public List<Long> getAllAccountIds() {
        return ledgerRepository.findAllAccountIds();
    }
}
