package com.tradejournal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication(scanBasePackages = "com.tradejournal")
@EnableTransactionManagement
public class TradeJournalApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeJournalApplication.class, args);
    }
}
