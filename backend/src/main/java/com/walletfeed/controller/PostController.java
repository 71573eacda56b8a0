package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedRequests;
import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.model.Post;
import com.walletfeed.social.PostService;
import com.walletfeed.wallet.WalletAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class PostController {

    private final PostService postService;
    private final WalletAuthenticator walletAuthenticator;
    private final WalletFeedResponseMapper responseMapper;

    public PostController(
            PostService postService,
            WalletAuthenticator walletAuthenticator,
            WalletFeedResponseMapper responseMapper) {
        this.postService = postService;
        this.walletAuthenticator = walletAuthenticator;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/posts")
    public ResponseEntity<WalletFeedResponses.PostResponse> createPost(
            HttpServletRequest request,
            @Valid @RequestBody WalletFeedRequests.CreatePostRequest body) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        Post post = postService.createPost(wallet, body.text(), body.imageUrl(), body.quotedPostId(), body.taggedWallets());
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toPostResponse(post));
    }

    @GetMapping("/posts/{postId}")
    public ResponseEntity<WalletFeedResponses.PostResponse> getPost(@PathVariable Long postId) {
        return ResponseEntity.ok(responseMapper.toPostResponse(postService.getPost(postId)));
    }

    @PutMapping("/posts/{postId}")
    public ResponseEntity<WalletFeedResponses.PostResponse> updatePost(
            HttpServletRequest request,
            @PathVariable Long postId,
            @Valid @RequestBody WalletFeedRequests.UpdatePostRequest body) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        Post post = postService.updatePost(wallet, postId, body.text(), body.imageUrl());
        return ResponseEntity.ok(responseMapper.toPostResponse(post));
    }

    @DeleteMapping("/posts/{postId}")
    public ResponseEntity<Void> deletePost(HttpServletRequest request, @PathVariable Long postId) {
        postService.deletePost(walletAuthenticator.authenticatedWallet(request), postId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/posts/{postId}/repost")
    public ResponseEntity<WalletFeedResponses.PostResponse> repost(HttpServletRequest request, @PathVariable Long postId) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        Post share = postService.repost(wallet, postId);
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toPostResponse(share));
    }

    @GetMapping("/wallets/{address}/posts")
    public ResponseEntity<WalletFeedResponses.PageResponse<WalletFeedResponses.PostResponse>> listByAuthor(
            @PathVariable String address,
            @RequestParam(defaultValue = "0") int page) {
        return ResponseEntity.ok(responseMapper.toPageResponse(
                postService.listPostsByAuthor(address, page), responseMapper::toPostResponse));
    }

    @GetMapping("/feed")
    public ResponseEntity<WalletFeedResponses.PageResponse<WalletFeedResponses.PostResponse>> feed(
            HttpServletRequest request,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        return ResponseEntity.ok(responseMapper.toPageResponse(
                postService.getFeed(wallet, page, size), responseMapper::toPostResponse));
    }
}
