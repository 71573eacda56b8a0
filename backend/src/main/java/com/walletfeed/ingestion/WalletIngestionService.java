package com.walletfeed.ingestion;

import com.walletfeed.jobs.JobMessage;
import com.walletfeed.jobs.JobQueue;
import com.walletfeed.wallet.WalletAddresses;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers that want a wallet ingested. Never fetches inline.
 */
@Service
@RequiredArgsConstructor
public class WalletIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WalletIngestionService.class);

    private final JobQueue jobQueue;

    /**
     * @return the checksummed address the job was queued for
     */
    public String requestIngestion(String address) {
        String wallet = WalletAddresses.toChecksum(address);
        jobQueue.enqueue(JobMessage.ingestWallet(wallet));
        log.debug("Queued ingestion for {}", wallet);
        return wallet;
    }
}
