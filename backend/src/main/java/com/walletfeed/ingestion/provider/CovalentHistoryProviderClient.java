package com.walletfeed.ingestion.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.wallet.WalletAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Covalent {@code transactions_v2} client. One GET per page, no retries.
 */
@Component
@ConditionalOnProperty(prefix = "walletfeed.provider", name = "mode", havingValue = "covalent", matchIfMissing = true)
public class CovalentHistoryProviderClient implements HistoryProviderClient {

    private static final Logger log = LoggerFactory.getLogger(CovalentHistoryProviderClient.class);

    static final String TRANSACTIONS_PATH =
            "/{chainId}/address/{address}/transactions_v2/?page-number={page}&page-size={size}&key={key}";

    private final RestClient restClient;
    private final WalletFeedProperties properties;

    public CovalentHistoryProviderClient(
            @Qualifier("historyProviderRestClient") RestClient restClient,
            WalletFeedProperties properties
    ) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public HistoryPage fetchPage(String address, int pageNumber) {
        WalletAddresses.requireChecksummed(address);
        if (pageNumber < 0) {
            throw new IllegalArgumentException("pageNumber must be >= 0");
        }

        WalletFeedProperties.Provider provider = properties.getProvider();
        JsonNode payload;
        try {
            payload = restClient.get()
                    .uri(TRANSACTIONS_PATH,
                            provider.getChainId(),
                            address,
                            pageNumber,
                            provider.getPageSize(),
                            provider.getApiKey())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw new ProviderException(
                    "History provider returned HTTP " + ex.getStatusCode().value() + " for " + address + " page " + pageNumber,
                    ex
            );
        } catch (RestClientException ex) {
            throw new ProviderException("History provider call failed for " + address + " page " + pageNumber, ex);
        }

        try {
            HistoryPage page = CovalentPayloadParser.fromJson(payload, provider.getChainId());
            log.debug("Fetched {} transactions for {} page {} (hasMore={})",
                    page.transactions().size(), address, pageNumber, page.hasMore());
            return page;
        } catch (IllegalArgumentException ex) {
            throw new ProviderException("Malformed history payload for " + address + " page " + pageNumber + ": "
                    + ex.getMessage(), ex);
        }
    }
}
