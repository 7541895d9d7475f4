package com.flagship.practice_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PracticeLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PracticeLedgerApplication.class, args);
    }
}
