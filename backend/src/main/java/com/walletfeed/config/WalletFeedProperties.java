package com.walletfeed.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runtime settings for history ingestion, the background job queue and
 * the self-scheduling wallet refresh.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "walletfeed")
public class WalletFeedProperties {

    private Provider provider = new Provider();
    private Ingestion ingestion = new Ingestion();
    private Jobs jobs = new Jobs();
    private Scheduler scheduler = new Scheduler();

    @Getter
    @Setter
    public static class Provider {
        /**
         * "covalent" for the live indexer, "mock" for the bundled fixture.
         */
        private String mode = "covalent";
        private String baseUrl = "https://api.covalenthq.com/v1";
        private String apiKey = "";
        private int chainId = 1;
        private int pageSize = 100;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Ingestion {
        private boolean enabled = true;
        /**
         * Maximum transactions per ingestion job; unset means page until the provider reports no more.
         */
        private Integer transactionLimit;
        private boolean ingestOnLogin = true;
    }

    @Getter
    @Setter
    public static class Jobs {
        private String queueMode = "in_memory";
        private String redisKeyPrefix = "walletfeed:jobs";
        private long redisPopTimeoutSeconds = 1;
        private long promotePollIntervalMs = 500;
        /**
         * Extra lifetime on a registry entry past its run time, so a crashed dispatcher cannot pin it forever.
         */
        private Duration registryGrace = Duration.ofHours(1);
        private int workerThreads = 4;
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 5_000;
        private double retryJitterFactor = 0.2;
        private int workerQueueCapacity = 1_000;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private boolean bootstrapOnStartup = true;
        private Duration minRefreshDelay = Duration.ofMinutes(1);
        private long watchdogIntervalMs = 300_000;
    }
}
