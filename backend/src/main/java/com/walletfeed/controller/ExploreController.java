package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.social.FollowService;
import com.walletfeed.wallet.HeaderWalletAuthenticator;
import com.walletfeed.wallet.WalletAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/explore")
public class ExploreController {

    private final FollowService followService;
    private final WalletAuthenticator walletAuthenticator;
    private final WalletFeedResponseMapper responseMapper;

    public ExploreController(
            FollowService followService,
            WalletAuthenticator walletAuthenticator,
            WalletFeedResponseMapper responseMapper) {
        this.followService = followService;
        this.walletAuthenticator = walletAuthenticator;
        this.responseMapper = responseMapper;
    }

    @GetMapping
    public ResponseEntity<List<WalletFeedResponses.WalletProfile>> explore(HttpServletRequest request) {
        String viewer = request.getHeader(HeaderWalletAuthenticator.WALLET_HEADER) == null
                ? null
                : walletAuthenticator.authenticatedWallet(request);
        return ResponseEntity.ok(followService.explore(viewer).stream()
                .map(responseMapper::toWalletProfile)
                .toList());
    }
}
