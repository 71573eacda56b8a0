package com.walletfeed.wallet;

import com.walletfeed.web.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Trusts the wallet header stamped by the signature-verifying gateway.
 */
@Component
public class HeaderWalletAuthenticator implements WalletAuthenticator {

    public static final String WALLET_HEADER = "X-Wallet-Address";

    @Override
    public String authenticatedWallet(HttpServletRequest request) {
        String header = request.getHeader(WALLET_HEADER);
        if (header == null || header.isBlank()) {
            throw new UnauthenticatedException("Missing " + WALLET_HEADER + " header");
        }
        String wallet = header.trim();
        if (!WalletAddresses.isValid(wallet)) {
            throw new UnauthenticatedException("Invalid wallet address in " + WALLET_HEADER);
        }
        return WalletAddresses.toChecksum(wallet);
    }
}
