package com.flagship.contractor_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContractorLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContractorLedgerApplication.class, args);
    }
}
