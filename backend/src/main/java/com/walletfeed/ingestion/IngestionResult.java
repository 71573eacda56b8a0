package com.walletfeed.ingestion;

import java.time.OffsetDateTime;

/**
 * Summary of one ingestion run for a wallet.
 *
 * @param nextUpdateAt most recent non-null refresh hint, or {@code null} when no page carried one
 */
public record IngestionResult(
        int pagesFetched,
        int transactionsSeen,
        int transactionsCreated,
        int transfersCreated,
        int postsCreated,
        OffsetDateTime nextUpdateAt
) {
}
