package com.walletfeed.jobs;

import com.walletfeed.config.WalletFeedProperties;
import com.walletfeed.wallet.WalletUserService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Arms the wallet refresh once the application is ready, and re-arms it
 * periodically if the pending entry was lost (queue restart, expired key).
 */
@Component
@RequiredArgsConstructor
public class RefreshBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RefreshBootstrap.class);

    private final RefreshScheduler refreshScheduler;
    private final WalletUserService walletUserService;
    private final WalletFeedProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        bootstrap();
    }

    @Scheduled(
            fixedDelayString = "${walletfeed.scheduler.watchdog-interval-ms:300000}",
            initialDelayString = "${walletfeed.scheduler.watchdog-interval-ms:300000}"
    )
    public void watchdogTick() {
        if (!properties.getScheduler().isEnabled() || refreshScheduler.isRefreshScheduled()) {
            return;
        }
        if (arm("watchdog")) {
            log.warn("Wallet refresh was not scheduled; re-armed by watchdog");
        }
    }

    boolean bootstrap() {
        WalletFeedProperties.Scheduler scheduler = properties.getScheduler();
        if (!scheduler.isEnabled() || !scheduler.isBootstrapOnStartup()) {
            log.debug("Refresh bootstrap skipped (enabled={}, bootstrapOnStartup={})",
                    scheduler.isEnabled(), scheduler.isBootstrapOnStartup());
            return false;
        }
        return arm("startup");
    }

    private boolean arm(String source) {
        if (walletUserService.allWallets().isEmpty()) {
            log.debug("Refresh arming ({}) skipped: no wallets registered", source);
            return false;
        }
        return refreshScheduler.ensureRefreshScheduled(null);
    }
}
