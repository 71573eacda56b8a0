package com.walletfeed.jobs;

/**
 * A unit of background work.
 *
 * @param jobName one of {@link JobNames}
 * @param address wallet the job targets, {@code null} for wallet-independent jobs
 * @param attempt one-based delivery attempt
 */
public record JobMessage(
        String jobName,
        String address,
        int attempt
) {
    public JobMessage {
        if (jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("jobName is required");
        }
        jobName = jobName.trim();
        if (JobNames.INGEST_WALLET.equals(jobName) && (address == null || address.isBlank())) {
            throw new IllegalArgumentException("address is required for " + JobNames.INGEST_WALLET);
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
    }

    public static JobMessage ingestWallet(String address) {
        return new JobMessage(JobNames.INGEST_WALLET, address, 1);
    }

    public static JobMessage refreshAllWallets() {
        return new JobMessage(JobNames.REFRESH_ALL_WALLETS, null, 1);
    }

    public JobMessage nextAttempt() {
        return new JobMessage(jobName, address, attempt + 1);
    }
}
