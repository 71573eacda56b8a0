package com.walletfeed.jobs;

public final class JobNames {

    public static final String INGEST_WALLET = "ingest-wallet";
    public static final String REFRESH_ALL_WALLETS = "refresh-all-wallets";

    private JobNames() {
    }
}
