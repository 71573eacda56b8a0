package com.walletfeed.config;

import com.walletfeed.jobs.JobRetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool and retry policy for background jobs.
 */
@Configuration
public class JobExecutorConfig {

    public static final String JOB_WORKER_EXECUTOR = "jobWorkerExecutor";

    /** Jobs beyond the queue capacity run on the dispatcher thread, which throttles intake. */
    @Bean(name = JOB_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor jobWorkerExecutor(WalletFeedProperties properties) {
        int threads = Math.max(1, properties.getJobs().getWorkerThreads());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setQueueCapacity(Math.max(1, properties.getJobs().getWorkerQueueCapacity()));
        e.setThreadNamePrefix("job-worker-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }

    @Bean
    public JobRetryPolicy jobRetryPolicy(WalletFeedProperties properties) {
        WalletFeedProperties.Jobs jobs = properties.getJobs();
        return new JobRetryPolicy(jobs.getRetryBaseDelayMs(), jobs.getRetryJitterFactor(), jobs.getMaxAttempts());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
