package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.social.FollowService;
import com.walletfeed.wallet.HeaderWalletAuthenticator;
import com.walletfeed.wallet.WalletAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Follow graph endpoints keyed by wallet address.
 */
@RestController
@RequestMapping("/api/wallets/{address}")
public class WalletController {

    private final FollowService followService;
    private final WalletAuthenticator walletAuthenticator;
    private final WalletFeedResponseMapper responseMapper;

    public WalletController(
            FollowService followService,
            WalletAuthenticator walletAuthenticator,
            WalletFeedResponseMapper responseMapper) {
        this.followService = followService;
        this.walletAuthenticator = walletAuthenticator;
        this.responseMapper = responseMapper;
    }

    /**
     * Follower counts; {@code followedByViewer} is only computed for authenticated callers.
     */
    @GetMapping
    public ResponseEntity<WalletFeedResponses.WalletProfile> profile(
            HttpServletRequest request,
            @PathVariable String address) {
        String viewer = request.getHeader(HeaderWalletAuthenticator.WALLET_HEADER) == null
                ? null
                : walletAuthenticator.authenticatedWallet(request);
        return ResponseEntity.ok(responseMapper.toWalletProfile(followService.stats(address, viewer)));
    }

    @PostMapping("/follow")
    public ResponseEntity<WalletFeedResponses.FollowResponse> follow(
            HttpServletRequest request,
            @PathVariable String address) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(responseMapper.toFollowResponse(followService.follow(wallet, address)));
    }

    @DeleteMapping("/follow")
    public ResponseEntity<Void> unfollow(HttpServletRequest request, @PathVariable String address) {
        followService.unfollow(walletAuthenticator.authenticatedWallet(request), address);
        return ResponseEntity.noContent().build();
    }
}
