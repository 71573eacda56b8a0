package com.walletfeed.ingestion.provider;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Abstraction over the third-party transaction-history indexer.
 * Implementations make exactly one outbound call per page and never retry.
 */
public interface HistoryProviderClient {

    /**
     * Fetches one page of a wallet's transaction history.
     *
     * @param address checksummed wallet address
     * @param pageNumber zero-based page index
     * @return the page, its continuation flag and the provider's next refresh hint
     * @throws ProviderException on transport failure, non-2xx status or a malformed payload
     */
    HistoryPage fetchPage(String address, int pageNumber);

    record HistoryPage(
            List<ProviderTransaction> transactions,
            boolean hasMore,
            OffsetDateTime nextUpdateAt
    ) {
        public HistoryPage {
            transactions = transactions == null ? List.of() : List.copyOf(transactions);
        }
    }

    record ProviderTransaction(
            int chainId,
            String txHash,
            OffsetDateTime blockSignedAt,
            int txOffset,
            boolean successful,
            String fromAddress,
            String toAddress,
            BigInteger value,
            List<ProviderErc20Transfer> erc20Transfers,
            List<ProviderErc721Transfer> erc721Transfers
    ) {
        public ProviderTransaction {
            erc20Transfers = erc20Transfers == null ? List.of() : List.copyOf(erc20Transfers);
            erc721Transfers = erc721Transfers == null ? List.of() : List.copyOf(erc721Transfers);
        }
    }

    record TokenContract(
            String address,
            String name,
            String ticker,
            String logoUrl
    ) {
    }

    record ProviderErc20Transfer(
            TokenContract contract,
            String fromAddress,
            String toAddress,
            BigInteger amount,
            int decimals
    ) {
    }

    record ProviderErc721Transfer(
            TokenContract contract,
            String fromAddress,
            String toAddress,
            BigInteger tokenId
    ) {
    }
}
