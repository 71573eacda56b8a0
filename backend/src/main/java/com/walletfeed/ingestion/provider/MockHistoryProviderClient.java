package com.walletfeed.ingestion.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.wallet.WalletAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixture-backed provider for local runs and demos.
 * <p>
 * The fixture is written for {@link #FIXTURE_WALLET}; every fetch rewrites that
 * wallet to the requested address and derives per-wallet transaction hashes so
 * different wallets never collide on {@code (chain_id, tx_hash)}.
 */
@Component
@ConditionalOnProperty(prefix = "walletfeed.provider", name = "mode", havingValue = "mock")
public class MockHistoryProviderClient implements HistoryProviderClient {

    private static final Logger log = LoggerFactory.getLogger(MockHistoryProviderClient.class);

    static final String FIXTURE_PATH = "provider/mock-tx-history.json";
    static final String FIXTURE_WALLET = "0x1111111111111111111111111111111111111111";

    private final List<ProviderTransaction> fixture;
    private final int pageSize;
    private final Clock clock;

    @Autowired
    public MockHistoryProviderClient(ObjectMapper objectMapper, WalletFeedProperties properties) {
        this(loadFixture(objectMapper, properties.getProvider().getChainId()),
                properties.getProvider().getPageSize(),
                Clock.systemUTC());
    }

    MockHistoryProviderClient(List<ProviderTransaction> fixture, int pageSize, Clock clock) {
        this.fixture = List.copyOf(fixture);
        this.pageSize = Math.max(1, pageSize);
        this.clock = clock;
    }

    @Override
    public HistoryPage fetchPage(String address, int pageNumber) {
        WalletAddresses.requireChecksummed(address);
        if (pageNumber < 0) {
            throw new IllegalArgumentException("pageNumber must be >= 0");
        }

        int from = Math.min(pageNumber * pageSize, fixture.size());
        int to = Math.min(from + pageSize, fixture.size());
        List<ProviderTransaction> transactions = new ArrayList<>(to - from);
        for (ProviderTransaction transaction : fixture.subList(from, to)) {
            transactions.add(rewrite(transaction, address));
        }
        log.debug("Mock provider served {} transactions for {} page {}", transactions.size(), address, pageNumber);
        return new HistoryPage(transactions, to < fixture.size(), OffsetDateTime.now(clock).plusMinutes(5));
    }

    private static ProviderTransaction rewrite(ProviderTransaction transaction, String address) {
        List<ProviderErc20Transfer> erc20 = transaction.erc20Transfers().stream()
                .map(t -> new ProviderErc20Transfer(
                        t.contract(), swap(t.fromAddress(), address), swap(t.toAddress(), address), t.amount(), t.decimals()))
                .toList();
        List<ProviderErc721Transfer> erc721 = transaction.erc721Transfers().stream()
                .map(t -> new ProviderErc721Transfer(
                        t.contract(), swap(t.fromAddress(), address), swap(t.toAddress(), address), t.tokenId()))
                .toList();
        return new ProviderTransaction(
                transaction.chainId(),
                Hash.sha3String(address.toLowerCase() + transaction.txHash()),
                transaction.blockSignedAt(),
                transaction.txOffset(),
                transaction.successful(),
                swap(transaction.fromAddress(), address),
                swap(transaction.toAddress(), address),
                transaction.value(),
                erc20,
                erc721
        );
    }

    private static String swap(String value, String address) {
        return WalletAddresses.sameAddress(value, FIXTURE_WALLET) ? address : value;
    }

    private static List<ProviderTransaction> loadFixture(ObjectMapper objectMapper, int chainId) {
        try (InputStream in = new ClassPathResource(FIXTURE_PATH).getInputStream()) {
            JsonNode payload = objectMapper.readTree(in);
            return CovalentPayloadParser.fromJson(payload, chainId).transactions();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to load mock history fixture " + FIXTURE_PATH, ex);
        }
    }
}
