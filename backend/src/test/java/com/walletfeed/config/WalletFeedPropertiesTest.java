package com.walletfeed.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WalletFeedPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(WalletFeedProperties.class);

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            assertTrue(context.containsBean("walletFeedProperties"));
            WalletFeedProperties properties = context.getBean(WalletFeedProperties.class);

            assertEquals("covalent", properties.getProvider().getMode());
            assertEquals("https://api.covalenthq.com/v1", properties.getProvider().getBaseUrl());
            assertEquals(1, properties.getProvider().getChainId());
            assertEquals(100, properties.getProvider().getPageSize());

            assertTrue(properties.getIngestion().isEnabled());
            assertTrue(properties.getIngestion().isIngestOnLogin());
            assertNull(properties.getIngestion().getTransactionLimit());

            assertEquals("in_memory", properties.getJobs().getQueueMode());
            assertEquals("walletfeed:jobs", properties.getJobs().getRedisKeyPrefix());
            assertEquals(Duration.ofHours(1), properties.getJobs().getRegistryGrace());
            assertEquals(3, properties.getJobs().getMaxAttempts());

            assertTrue(properties.getScheduler().isEnabled());
            assertEquals(Duration.ofMinutes(1), properties.getScheduler().getMinRefreshDelay());
        });
    }

    @Test
    void bindsOverrides() {
        contextRunner
                .withPropertyValues(
                        "walletfeed.provider.mode=mock",
                        "walletfeed.provider.chain-id=137",
                        "walletfeed.provider.read-timeout=10s",
                        "walletfeed.ingestion.transaction-limit=250",
                        "walletfeed.ingestion.ingest-on-login=false",
                        "walletfeed.jobs.queue-mode=redis",
                        "walletfeed.jobs.worker-threads=8",
                        "walletfeed.jobs.retry-jitter-factor=0",
                        "walletfeed.scheduler.min-refresh-delay=5m",
                        "walletfeed.scheduler.bootstrap-on-startup=false"
                )
                .run(context -> {
                    WalletFeedProperties properties = context.getBean(WalletFeedProperties.class);

                    assertEquals("mock", properties.getProvider().getMode());
                    assertEquals(137, properties.getProvider().getChainId());
                    assertEquals(Duration.ofSeconds(10), properties.getProvider().getReadTimeout());
                    assertEquals(250, properties.getIngestion().getTransactionLimit());
                    assertFalse(properties.getIngestion().isIngestOnLogin());
                    assertEquals("redis", properties.getJobs().getQueueMode());
                    assertEquals(8, properties.getJobs().getWorkerThreads());
                    assertEquals(0.0, properties.getJobs().getRetryJitterFactor());
                    assertEquals(Duration.ofMinutes(5), properties.getScheduler().getMinRefreshDelay());
                    assertFalse(properties.getScheduler().isBootstrapOnStartup());
                });
    }
}
