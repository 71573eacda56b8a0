package com.walletfeed.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the transaction-history provider.
 */
@Configuration
public class HistoryProviderConfig {

    @Bean
    public RestClient historyProviderRestClient(RestClient.Builder builder, WalletFeedProperties properties) {
        WalletFeedProperties.Provider provider = properties.getProvider();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) provider.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) provider.getReadTimeout().toMillis());
        return builder
                .baseUrl(provider.getBaseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .requestFactory(requestFactory)
                .build();
    }
}
