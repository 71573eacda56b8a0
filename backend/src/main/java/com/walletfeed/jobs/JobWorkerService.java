package com.walletfeed.jobs;

import com.walletfeed.config.JobExecutorConfig;
import com.walletfeed.ingestion.IngestionJobHandler;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Consumes the job queue and runs each job on the worker pool.
 * <p>
 * Failed ingestion jobs are rescheduled with backoff until the retry policy
 * is exhausted; when one gives up, the refresh cycle is re-armed with the
 * minimum delay. A failed refresh job is never rescheduled directly. It is
 * re-armed through {@link RefreshScheduler#ensureRefreshScheduled}, which
 * keeps at most one refresh pending.
 */
@Service
public class JobWorkerService {

    private static final Logger log = LoggerFactory.getLogger(JobWorkerService.class);

    private final JobQueue jobQueue;
    private final TaskExecutor jobWorkerExecutor;
    private final IngestionJobHandler ingestionJobHandler;
    private final RefreshScheduler refreshScheduler;
    private final JobRetryPolicy retryPolicy;
    private final Clock clock;

    public JobWorkerService(
            JobQueue jobQueue,
            @Qualifier(JobExecutorConfig.JOB_WORKER_EXECUTOR) TaskExecutor jobWorkerExecutor,
            IngestionJobHandler ingestionJobHandler,
            RefreshScheduler refreshScheduler,
            JobRetryPolicy retryPolicy,
            Clock clock) {
        this.jobQueue = jobQueue;
        this.jobWorkerExecutor = jobWorkerExecutor;
        this.ingestionJobHandler = ingestionJobHandler;
        this.refreshScheduler = refreshScheduler;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    @PostConstruct
    void registerQueueConsumer() {
        jobQueue.setConsumer(message -> jobWorkerExecutor.execute(() -> process(message)));
    }

    void process(JobMessage message) {
        try {
            run(message);
        } catch (RuntimeException ex) {
            handleFailure(message, ex);
        }
    }

    private void run(JobMessage message) {
        switch (message.jobName()) {
            case JobNames.INGEST_WALLET -> ingestionJobHandler.handle(message.address());
            case JobNames.REFRESH_ALL_WALLETS -> refreshScheduler.enqueueAllWalletsRefresh();
            default -> log.warn("Dropping job with unknown name {}", message.jobName());
        }
    }

    private void handleFailure(JobMessage message, RuntimeException failure) {
        if (JobNames.REFRESH_ALL_WALLETS.equals(message.jobName())) {
            log.warn("Wallet refresh failed on attempt {}; re-arming: {}", message.attempt(), failure.getMessage());
            refreshScheduler.ensureRefreshScheduled(null);
            return;
        }
        if (retryPolicy.canRetry(message.attempt())) {
            long delayMs = retryPolicy.delayMs(message.attempt());
            OffsetDateTime retryAt = OffsetDateTime.now(clock).plusNanos(delayMs * 1_000_000L);
            log.warn("Job {} for {} failed on attempt {}/{}; retrying at {}: {}",
                    message.jobName(), message.address(), message.attempt(), retryPolicy.getMaxAttempts(),
                    retryAt, failure.getMessage());
            jobQueue.schedule(message.nextAttempt(), retryAt);
            return;
        }

        log.error("Job {} for {} failed after {} attempt(s); dropping",
                message.jobName(), message.address(), message.attempt(), failure);
        if (JobNames.INGEST_WALLET.equals(message.jobName())) {
            refreshScheduler.ensureRefreshScheduled(null);
        }
    }
}
