package com.walletfeed.config;

import com.walletfeed.jobs.JobNames;
import com.walletfeed.jobs.JobQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class JobQueueHealthIndicator implements HealthIndicator {

    private final JobQueue jobQueue;

    public JobQueueHealthIndicator(JobQueue jobQueue) {
        this.jobQueue = jobQueue;
    }

    @Override
    public Health health() {
        try {
            Health.Builder builder = Health.up().withDetail("mode", jobQueue.mode());
            jobQueue.scheduledAt(JobNames.REFRESH_ALL_WALLETS).ifPresentOrElse(
                    runAt -> builder.withDetail("walletRefreshScheduledAt", runAt.toString()),
                    () -> builder.withDetail("walletRefreshScheduledAt", "none"));
            return builder.build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("mode", jobQueue.mode())
                    .withException(e)
                    .build();
        }
    }
}
