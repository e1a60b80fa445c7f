package com.flagship.debt_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DebtLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DebtLedgerApplication.class, args);
    }
}
