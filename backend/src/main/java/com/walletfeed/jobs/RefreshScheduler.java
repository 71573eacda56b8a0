package com.walletfeed.jobs;

import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.wallet.WalletUserService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Keeps at most one pending "refresh all wallets" job.
 * <p>
 * The registry entry {@link JobNames#REFRESH_ALL_WALLETS} is either absent or
 * holds the accepted run time. Ingestion jobs offer the provider's next-update
 * hint after every fetched page; only the first offer while the entry is
 * absent is taken. The refresh job clears the entry when it starts, so the ingestion jobs
 * it spawns can arm the next cycle.
 */
@Service
@RequiredArgsConstructor
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    static final String REGISTRY_KEY = JobNames.REFRESH_ALL_WALLETS;

    private final JobQueue jobQueue;
    private final WalletUserService walletUserService;
    private final WalletFeedProperties properties;
    private final Clock clock;

    /**
     * Schedules the refresh-all job unless one is already pending.
     *
     * @param runAt provider hint; {@code null} or a time sooner than the minimum delay is pushed out
     * @return {@code true} when this call scheduled the job
     */
    public boolean ensureRefreshScheduled(OffsetDateTime runAt) {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Refresh scheduling skipped: scheduler disabled");
            return false;
        }
        OffsetDateTime earliest = OffsetDateTime.now(clock).plus(properties.getScheduler().getMinRefreshDelay());
        OffsetDateTime effective = runAt == null || runAt.isBefore(earliest) ? earliest : runAt;

        boolean scheduled = jobQueue.scheduleIfAbsent(REGISTRY_KEY, JobMessage.refreshAllWallets(), effective);
        if (scheduled) {
            log.info("Scheduled wallet refresh at {}", effective);
        } else {
            log.debug("Wallet refresh already scheduled at {}; ignoring hint {}",
                    jobQueue.scheduledAt(REGISTRY_KEY).orElse(null), runAt);
        }
        return scheduled;
    }

    /**
     * Clears the pending marker and enqueues one ingestion job per known wallet.
     *
     * @return number of ingestion jobs enqueued
     */
    public int enqueueAllWalletsRefresh() {
        jobQueue.release(REGISTRY_KEY);
        List<String> wallets = walletUserService.allWallets();
        for (String wallet : wallets) {
            jobQueue.enqueue(JobMessage.ingestWallet(wallet));
        }
        log.info("Wallet refresh enqueued {} ingestion job(s)", wallets.size());
        return wallets.size();
    }

    public boolean isRefreshScheduled() {
        return jobQueue.isScheduled(REGISTRY_KEY);
    }
}
