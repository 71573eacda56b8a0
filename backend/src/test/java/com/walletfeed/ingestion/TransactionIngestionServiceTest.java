package com.walletfeed.ingestion;

import com.walletfeed.ingestion.provider.HistoryProviderClient;
import com.walletfeed.ingestion.provider.HistoryProviderClient.HistoryPage;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderErc20Transfer;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderErc721Transfer;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderTransaction;
import com.walletfeed.ingestion.provider.HistoryProviderClient.TokenContract;
import com.walletfeed.ingestion.provider.ProviderException;
import com.walletfeed.model.Post;
import com.walletfeed.model.Transaction;
import com.walletfeed.model.WalletUser;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.repository.TransactionRepository;
import com.walletfeed.wallet.WalletAddresses;
import com.walletfeed.wallet.WalletUserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionIngestionServiceTest {

    private static final String WALLET = "0x5555555555555555555555555555555555555555";
    private static final String COUNTERPARTY = "0x6666666666666666666666666666666666666666";
    private static final TokenContract TOKEN = new TokenContract(
            "0x7777777777777777777777777777777777777777", "Token", "TKN", null);

    @Mock
    private HistoryProviderClient historyProviderClient;

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private PostRepository postRepository;

    @Mock
    private WalletUserService walletUserService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final Map<String, Transaction> storedTransactions = new HashMap<>();
    private final List<Post> storedPosts = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();
    private final List<OffsetDateTime> hints = new ArrayList<>();

    private TransactionIngestionService service;
    private WalletUser author;

    @BeforeEach
    void setUp() {
        author = new WalletUser(WALLET);
        author.setId(1L);
        lenient().when(walletUserService.getOrCreate(anyString())).thenReturn(author);

        lenient().when(transactionRepository.findByChainIdAndTxHash(anyInt(), anyString())).thenAnswer(invocation ->
                Optional.ofNullable(storedTransactions.get(invocation.getArgument(0) + ":" + invocation.getArgument(1))));
        lenient().when(transactionRepository.save(any(Transaction.class))).thenAnswer(invocation -> {
            Transaction transaction = invocation.getArgument(0);
            transaction.setId(ids.incrementAndGet());
            storedTransactions.put(transaction.getChainId() + ":" + transaction.getTxHash(), transaction);
            return transaction;
        });
        lenient().when(postRepository.existsOriginalPostForTransaction(anyLong(), anyLong())).thenAnswer(invocation ->
                storedPosts.stream().anyMatch(post -> post.getAuthor().getId().equals(invocation.getArgument(0))
                        && post.getRefTx().getId().equals(invocation.getArgument(1))));
        lenient().when(postRepository.save(any(Post.class))).thenAnswer(invocation -> {
            Post post = invocation.getArgument(0);
            storedPosts.add(post);
            return post;
        });

        TransferRecordStore store = new TransferRecordStore(transactionRepository, transactionManager);
        service = new TransactionIngestionService(
                historyProviderClient, store, postRepository, walletUserService, transactionManager);
    }

    @Test
    void ingestStoresTransfersAndDerivesPostsOnlyForSentTransactions() {
        OffsetDateTime hint = OffsetDateTime.parse("2024-06-01T00:05:00Z");
        when(historyProviderClient.fetchPage(WALLET, 0)).thenReturn(new HistoryPage(List.of(
                outgoingErc20("0x01"),
                outgoingErc721("0x02"),
                incoming("0x03")
        ), false, hint));

        IngestionResult result = service.ingest(WALLET, null, hints::add);

        assertEquals(1, result.pagesFetched());
        assertEquals(3, result.transactionsSeen());
        assertEquals(3, result.transactionsCreated());
        assertEquals(2, result.transfersCreated());
        assertEquals(2, result.postsCreated());
        assertEquals(hint, result.nextUpdateAt());
        assertEquals(2, storedPosts.size());
        assertTrue(storedPosts.stream().allMatch(post -> post.getAuthor() == author));
        assertTrue(storedPosts.stream().noneMatch(post -> "0x03".equals(post.getRefTx().getTxHash())));
    }

    @Test
    void reingestingSameHistoryCreatesNothingNew() {
        when(historyProviderClient.fetchPage(WALLET, 0)).thenReturn(new HistoryPage(List.of(
                outgoingErc20("0x01"),
                incoming("0x03")
        ), false, null));

        service.ingest(WALLET, null, hints::add);
        IngestionResult second = service.ingest(WALLET, null, hints::add);

        assertEquals(2, second.transactionsSeen());
        assertEquals(0, second.transactionsCreated());
        assertEquals(0, second.transfersCreated());
        assertEquals(0, second.postsCreated());
        assertEquals(2, storedTransactions.size());
        assertEquals(1, storedPosts.size());
    }

    @Test
    void ingestFollowsPaginationAndReportsEveryPageHint() {
        OffsetDateTime firstHint = OffsetDateTime.parse("2024-06-01T00:05:00Z");
        when(historyProviderClient.fetchPage(WALLET, 0))
                .thenReturn(new HistoryPage(List.of(outgoingErc20("0x01")), true, firstHint));
        when(historyProviderClient.fetchPage(WALLET, 1))
                .thenReturn(new HistoryPage(List.of(outgoingErc721("0x02")), false, firstHint.plusHours(1)));

        IngestionResult result = service.ingest(WALLET, null, hints::add);

        assertEquals(2, result.pagesFetched());
        assertEquals(2, result.transactionsCreated());
        assertEquals(List.of(firstHint, firstHint.plusHours(1)), hints);
        assertEquals(firstHint.plusHours(1), result.nextUpdateAt());
    }

    @Test
    void ingestStopsAtTransactionLimit() {
        when(historyProviderClient.fetchPage(WALLET, 0)).thenReturn(new HistoryPage(List.of(
                outgoingErc20("0x01"),
                outgoingErc20("0x02"),
                outgoingErc20("0x03")
        ), true, null));

        IngestionResult result = service.ingest(WALLET, 2, hints::add);

        assertEquals(2, result.transactionsSeen());
        assertEquals(2, storedTransactions.size());
        verify(historyProviderClient, never()).fetchPage(WALLET, 1);
    }

    @Test
    void providerFailureKeepsTransactionsFromEarlierPages() {
        when(historyProviderClient.fetchPage(WALLET, 0))
                .thenReturn(new HistoryPage(List.of(outgoingErc20("0x01")), true, null));
        when(historyProviderClient.fetchPage(WALLET, 1)).thenThrow(new ProviderException("HTTP 503"));

        assertThrows(ProviderException.class, () -> service.ingest(WALLET, null, hints::add));

        assertEquals(1, storedTransactions.size());
        assertEquals(1, storedPosts.size());
    }

    @Test
    void firstPageHintIsReportedEvenWhenLaterPageFails() {
        OffsetDateTime hint = OffsetDateTime.parse("2024-06-01T00:05:00Z");
        when(historyProviderClient.fetchPage(WALLET, 0))
                .thenReturn(new HistoryPage(List.of(outgoingErc20("0x01")), true, hint));
        when(historyProviderClient.fetchPage(WALLET, 1)).thenThrow(new ProviderException("HTTP 503"));

        assertThrows(ProviderException.class, () -> service.ingest(WALLET, null, hints::add));

        assertEquals(List.of(hint), hints);
    }

    @Test
    void laterPageWithoutHintKeepsEarlierHint() {
        OffsetDateTime hint = OffsetDateTime.parse("2024-06-01T00:05:00Z");
        when(historyProviderClient.fetchPage(WALLET, 0))
                .thenReturn(new HistoryPage(List.of(outgoingErc20("0x01")), true, hint));
        when(historyProviderClient.fetchPage(WALLET, 1))
                .thenReturn(new HistoryPage(List.of(incoming("0x02")), false, null));

        IngestionResult result = service.ingest(WALLET, null, hints::add);

        assertEquals(hint, result.nextUpdateAt());
        assertEquals(2, hints.size());
    }

    @Test
    void emptyHistoryReturnsZeroCounts() {
        when(historyProviderClient.fetchPage(WALLET, 0)).thenReturn(new HistoryPage(List.of(), true, null));

        IngestionResult result = service.ingest(WALLET, null, hints::add);

        assertEquals(1, result.pagesFetched());
        assertEquals(0, result.transactionsSeen());
        assertNull(result.nextUpdateAt());
    }

    @Test
    void ingestChecksumsAddressBeforeFetching() {
        String lowercase = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
        String checksummed = WalletAddresses.toChecksum(lowercase);
        when(historyProviderClient.fetchPage(eq(checksummed), eq(0))).thenReturn(new HistoryPage(List.of(), false, null));

        service.ingest(lowercase, null, hints::add);

        verify(walletUserService).getOrCreate(checksummed);
    }

    @Test
    void ingestRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> service.ingest(WALLET, 0, hints::add));
        verifyNoInteractions(historyProviderClient);
    }

    private static ProviderTransaction outgoingErc20(String hash) {
        return transaction(hash, WALLET, COUNTERPARTY,
                List.of(new ProviderErc20Transfer(TOKEN, WALLET, COUNTERPARTY, BigInteger.TEN, 6)),
                List.of());
    }

    private static ProviderTransaction outgoingErc721(String hash) {
        return transaction(hash, WALLET, COUNTERPARTY,
                List.of(),
                List.of(new ProviderErc721Transfer(TOKEN, WALLET, COUNTERPARTY, BigInteger.ONE)));
    }

    private static ProviderTransaction incoming(String hash) {
        return transaction(hash, COUNTERPARTY, WALLET, List.of(), List.of());
    }

    private static ProviderTransaction transaction(
            String hash,
            String from,
            String to,
            List<ProviderErc20Transfer> erc20,
            List<ProviderErc721Transfer> erc721
    ) {
        return new ProviderTransaction(1, hash, OffsetDateTime.parse("2024-06-01T00:00:00Z"), 0, true,
                from, to, BigInteger.ZERO, erc20, erc721);
    }
}
