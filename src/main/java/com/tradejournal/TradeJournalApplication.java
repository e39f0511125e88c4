package com.tradejournal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradeJournalApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeJournalApplication.class, args);
    }
}
