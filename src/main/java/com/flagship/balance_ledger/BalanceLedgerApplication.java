package com.flagship.balance_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BalanceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BalanceLedgerApplication.class, args);
    }
}
