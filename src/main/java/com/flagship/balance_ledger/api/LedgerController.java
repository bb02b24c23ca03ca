package com.flagship.balance_ledger.api;

import com.flagship.balance_ledger.api.dto.AccountResponse;
import com.flagship.balance_ledger.api.dto.BalanceResponse;
import com.flagship.balance_ledger.api.dto.CreateAccountRequest;
import com.flagship.balance_ledger.api.dto.CreateTransferRequest;
import com.flagship.balance_ledger.api.dto.TransactionResponse;
import com.flagship.balance_ledger.integrity.IntegrityReport;
import com.flagship.balance_ledger.integrity.IntegrityVerifier;
import com.flagship.balance_ledger.ledger.AccountService;
import com.flagship.balance_ledger.ledger.LedgerService;
import com.flagship.balance_ledger.ledger.LedgerTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller over the ledger library, for load drivers and integrity checkers.
 *
 * Transfers are not idempotent: a client that retries a POST after a lost response
 * may transfer twice.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final IntegrityVerifier integrityVerifier;

    @PostMapping("/accounts")
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        long accountId = accountService.createAccount(request.getName());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AccountResponse.builder()
                .accountId(accountId)
                .name(request.getName())
                .balance(ledgerService.getBalance(accountId))
                .build());
    }

    @GetMapping("/accounts")
    public List<Long> getAccountIds() {
        return accountService.getAllAccountIds();
    }

    @GetMapping("/accounts/{id}/balance")
    public BalanceResponse getBalance(@PathVariable("id") long accountId) {
        return new BalanceResponse(accountId, ledgerService.getBalance(accountId));
    }

    @GetMapping("/accounts/{id}/transactions")
    public List<TransactionResponse> getTransactions(@PathVariable("id") long accountId) {
        return ledgerService.getTransactionsForAccount(accountId).stream()
            .map(TransactionResponse::from)
            .toList();
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransactionResponse> transferFunds(@Valid @RequestBody CreateTransferRequest request) {
        log.info("Received transfer request: from={}, to={}, amount={}",
                request.getFromAccountId(), request.getToAccountId(), request.getAmount());

        long transactionId = ledgerService.transferFunds(
            request.getFromAccountId(),
            request.getToAccountId(),
            request.getAmount()
        );

        LedgerTransaction transaction = ledgerService.getTransaction(transactionId)
            .orElseThrow(() -> new IllegalStateException(
                "Transfer committed but transaction not found: " + transactionId));

        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @GetMapping("/integrity")
    public ResponseEntity<IntegrityReport> checkIntegrity() {
        IntegrityReport report = integrityVerifier.verify();
        return ResponseEntity.status(report.isHealthy() ? HttpStatus.OK : HttpStatus.CONFLICT).body(report);
    }
}
