package com.walletfeed.ingestion;

import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.jobs.RefreshScheduler;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one wallet's ingestion. Every page's refresh hint goes to the scheduler as soon as
 * the page is fetched.
 */
@Service
@RequiredArgsConstructor
public class IngestionJobHandler {

    private static final Logger log = LoggerFactory.getLogger(IngestionJobHandler.class);

    private final TransactionIngestionService transactionIngestionService;
    private final RefreshScheduler refreshScheduler;
    private final WalletFeedProperties properties;

    public IngestionResult handle(String address) {
        if (!properties.getIngestion().isEnabled()) {
            log.debug("Ingestion for {} skipped: ingestion disabled", address);
            return new IngestionResult(0, 0, 0, 0, 0, null);
        }
        return transactionIngestionService.ingest(
                address, properties.getIngestion().getTransactionLimit(), refreshScheduler::ensureRefreshScheduled);
    }
}
