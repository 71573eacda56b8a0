package com.walletfeed.wallet;

import com.walletfeed.web.UnauthenticatedException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HeaderWalletAuthenticatorTest {

    private final HeaderWalletAuthenticator authenticator = new HeaderWalletAuthenticator();

    @Test
    void returnsChecksummedWalletFromHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(HeaderWalletAuthenticator.WALLET_HEADER, " 0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48 ");

        assertEquals("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", authenticator.authenticatedWallet(request));
    }

    @Test
    void missingHeaderIsUnauthenticated() {
        UnauthenticatedException ex = assertThrows(UnauthenticatedException.class,
                () -> authenticator.authenticatedWallet(new MockHttpServletRequest()));

        assertEquals("unauthenticated", ex.getCode());
    }

    @Test
    void blankOrMalformedHeaderIsUnauthenticated() {
        MockHttpServletRequest blank = new MockHttpServletRequest();
        blank.addHeader(HeaderWalletAuthenticator.WALLET_HEADER, "   ");
        MockHttpServletRequest malformed = new MockHttpServletRequest();
        malformed.addHeader(HeaderWalletAuthenticator.WALLET_HEADER, "vitalik.eth");

        assertThrows(UnauthenticatedException.class, () -> authenticator.authenticatedWallet(blank));
        assertThrows(UnauthenticatedException.class, () -> authenticator.authenticatedWallet(malformed));
    }
}
