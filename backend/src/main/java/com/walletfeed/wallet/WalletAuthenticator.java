package com.walletfeed.wallet;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the verified wallet behind a request. Signature checking happens
 * upstream; implementations only read its outcome.
 */
public interface WalletAuthenticator {

    /**
     * @return the checksummed wallet address of the caller
     * @throws com.walletfeed.web.UnauthenticatedException when no verified wallet is attached
     */
    String authenticatedWallet(HttpServletRequest request);
}
