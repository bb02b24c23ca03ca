package com.flagship.balance_ledger.integrity;

import lombok.Getter;

@Getter
public class LedgerIntegrityException extends IllegalStateException {

    private final transient IntegrityReport report;

    public LedgerIntegrityException(IntegrityReport report) {
        super(String.format("Ledger integrity check failed: totalBalance=%s, driftedAccounts=%d",
            report.getTotalBalance(), report.getDriftedAccounts().size()));
        this.report = report;
    }
}
