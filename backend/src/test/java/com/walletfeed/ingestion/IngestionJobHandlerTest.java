package com.walletfeed.ingestion;

import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.ingestion.provider.ProviderException;
import com.walletfeed.jobs.RefreshScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionJobHandlerTest {

    private static final String WALLET = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";
    private static final OffsetDateTime HINT = OffsetDateTime.of(2024, 3, 10, 12, 30, 0, 0, ZoneOffset.UTC);

    @Mock
    private TransactionIngestionService transactionIngestionService;

    @Mock
    private RefreshScheduler refreshScheduler;

    private WalletFeedProperties properties;
    private IngestionJobHandler handler;

    @BeforeEach
    void setUp() {
        properties = new WalletFeedProperties();
        handler = new IngestionJobHandler(transactionIngestionService, refreshScheduler, properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void handlePassesProviderHintToScheduler() {
        IngestionResult result = new IngestionResult(2, 5, 5, 3, 2, HINT);
        when(transactionIngestionService.ingest(eq(WALLET), isNull(), any())).thenAnswer(invocation -> {
            invocation.getArgument(2, Consumer.class).accept(HINT);
            return result;
        });

        assertSame(result, handler.handle(WALLET));
        verify(refreshScheduler).ensureRefreshScheduled(HINT);
    }

    @Test
    @SuppressWarnings("unchecked")
    void hintReachesSchedulerWhenLaterPageFails() {
        when(transactionIngestionService.ingest(eq(WALLET), isNull(), any())).thenAnswer(invocation -> {
            invocation.getArgument(2, Consumer.class).accept(HINT);
            throw new ProviderException("HTTP 503");
        });

        assertThrows(ProviderException.class, () -> handler.handle(WALLET));
        verify(refreshScheduler).ensureRefreshScheduled(HINT);
    }

    @Test
    @SuppressWarnings("unchecked")
    void handleUsesConfiguredTransactionLimit() {
        properties.getIngestion().setTransactionLimit(50);
        when(transactionIngestionService.ingest(eq(WALLET), eq(50), any())).thenAnswer(invocation -> {
            invocation.getArgument(2, Consumer.class).accept(null);
            return new IngestionResult(1, 50, 0, 0, 0, null);
        });

        handler.handle(WALLET);

        verify(refreshScheduler).ensureRefreshScheduled(isNull());
    }

    @Test
    void handleIsNoOpWhenIngestionDisabled() {
        properties.getIngestion().setEnabled(false);

        IngestionResult result = handler.handle(WALLET);

        assertEquals(0, result.pagesFetched());
        assertEquals(0, result.transactionsCreated());
        verifyNoInteractions(transactionIngestionService, refreshScheduler);
    }
}
