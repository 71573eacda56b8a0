package com.walletfeed.wallet;

import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.ingestion.WalletIngestionService;
import com.walletfeed.model.WalletUser;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers an authenticated wallet and queues a history refresh for it.
 */
@Service
@RequiredArgsConstructor
public class WalletLoginService {

    private static final Logger log = LoggerFactory.getLogger(WalletLoginService.class);

    private final WalletUserService walletUserService;
    private final WalletIngestionService walletIngestionService;
    private final WalletFeedProperties properties;

    public LoginResult login(String wallet) {
        WalletUser user = walletUserService.getOrCreate(wallet);
        boolean queue = properties.getIngestion().isEnabled() && properties.getIngestion().isIngestOnLogin();
        if (queue) {
            walletIngestionService.requestIngestion(user.getWallet());
        }
        log.info("Wallet {} logged in (ingestionQueued={})", user.getWallet(), queue);
        return new LoginResult(user.getWallet(), queue);
    }

    public record LoginResult(String wallet, boolean ingestionQueued) {
    }
}
