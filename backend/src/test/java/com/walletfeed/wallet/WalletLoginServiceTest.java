package com.walletfeed.wallet;

import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.ingestion.WalletIngestionService;
import com.walletfeed.model.WalletUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletLoginServiceTest {

    private static final String WALLET = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";

    @Mock
    private WalletUserService walletUserService;

    @Mock
    private WalletIngestionService walletIngestionService;

    private WalletFeedProperties properties;
    private WalletLoginService walletLoginService;

    @BeforeEach
    void setUp() {
        properties = new WalletFeedProperties();
        walletLoginService = new WalletLoginService(walletUserService, walletIngestionService, properties);
    }

    @Test
    void loginRegistersWalletAndQueuesIngestion() {
        when(walletUserService.getOrCreate(WALLET)).thenReturn(new WalletUser(WALLET));

        WalletLoginService.LoginResult result = walletLoginService.login(WALLET);

        assertEquals(WALLET, result.wallet());
        assertTrue(result.ingestionQueued());
        verify(walletIngestionService).requestIngestion(WALLET);
    }

    @Test
    void loginSkipsIngestionWhenDisabledOnLogin() {
        properties.getIngestion().setIngestOnLogin(false);
        when(walletUserService.getOrCreate(WALLET)).thenReturn(new WalletUser(WALLET));

        WalletLoginService.LoginResult result = walletLoginService.login(WALLET);

        assertFalse(result.ingestionQueued());
        verifyNoInteractions(walletIngestionService);
    }

    @Test
    void loginSkipsIngestionWhenIngestionDisabled() {
        properties.getIngestion().setEnabled(false);
        when(walletUserService.getOrCreate(WALLET)).thenReturn(new WalletUser(WALLET));

        assertFalse(walletLoginService.login(WALLET).ingestionQueued());
        verifyNoInteractions(walletIngestionService);
    }
}
