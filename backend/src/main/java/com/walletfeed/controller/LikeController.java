package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.social.LikeService;
import com.walletfeed.wallet.WalletAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class LikeController {

    private final LikeService likeService;
    private final WalletAuthenticator walletAuthenticator;
    private final WalletFeedResponseMapper responseMapper;

    public LikeController(
            LikeService likeService,
            WalletAuthenticator walletAuthenticator,
            WalletFeedResponseMapper responseMapper) {
        this.likeService = likeService;
        this.walletAuthenticator = walletAuthenticator;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/posts/{postId}/like")
    public ResponseEntity<WalletFeedResponses.LikeResponse> likePost(HttpServletRequest request, @PathVariable Long postId) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toLikeResponse(likeService.likePost(wallet, postId)));
    }

    @DeleteMapping("/posts/{postId}/like")
    public ResponseEntity<Void> unlikePost(HttpServletRequest request, @PathVariable Long postId) {
        likeService.unlikePost(walletAuthenticator.authenticatedWallet(request), postId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/comments/{commentId}/like")
    public ResponseEntity<WalletFeedResponses.LikeResponse> likeComment(
            HttpServletRequest request,
            @PathVariable Long commentId) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(responseMapper.toLikeResponse(likeService.likeComment(wallet, commentId)));
    }

    @DeleteMapping("/comments/{commentId}/like")
    public ResponseEntity<Void> unlikeComment(HttpServletRequest request, @PathVariable Long commentId) {
        likeService.unlikeComment(walletAuthenticator.authenticatedWallet(request), commentId);
        return ResponseEntity.noContent().build();
    }
}
