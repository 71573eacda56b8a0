package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.wallet.WalletAuthenticator;
import com.walletfeed.wallet.WalletLoginService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session entry point. The wallet signature is verified upstream.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final WalletAuthenticator walletAuthenticator;
    private final WalletLoginService walletLoginService;

    public AuthController(WalletAuthenticator walletAuthenticator, WalletLoginService walletLoginService) {
        this.walletAuthenticator = walletAuthenticator;
        this.walletLoginService = walletLoginService;
    }

    @PostMapping("/login")
    public ResponseEntity<WalletFeedResponses.LoginResponse> login(HttpServletRequest request) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        WalletLoginService.LoginResult result = walletLoginService.login(wallet);
        return ResponseEntity.ok(new WalletFeedResponses.LoginResponse(result.wallet(), result.ingestionQueued()));
    }
}
