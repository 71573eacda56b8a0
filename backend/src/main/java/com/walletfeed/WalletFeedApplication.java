package com.walletfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WalletFeedApplication {
    public static void main(String[] args) {
        SpringApplication.run(WalletFeedApplication.class, args);
    }
}
