package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedRequests;
import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.model.Comment;
import com.walletfeed.social.CommentService;
import com.walletfeed.wallet.WalletAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class CommentController {

    private final CommentService commentService;
    private final WalletAuthenticator walletAuthenticator;
    private final WalletFeedResponseMapper responseMapper;

    public CommentController(
            CommentService commentService,
            WalletAuthenticator walletAuthenticator,
            WalletFeedResponseMapper responseMapper) {
        this.commentService = commentService;
        this.walletAuthenticator = walletAuthenticator;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/posts/{postId}/comments")
    public ResponseEntity<WalletFeedResponses.CommentResponse> createComment(
            HttpServletRequest request,
            @PathVariable Long postId,
            @Valid @RequestBody WalletFeedRequests.CreateCommentRequest body) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        Comment comment = commentService.createComment(wallet, postId, body.text(), body.taggedWallets());
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toCommentResponse(comment));
    }

    @GetMapping("/posts/{postId}/comments")
    public ResponseEntity<List<WalletFeedResponses.CommentResponse>> listComments(@PathVariable Long postId) {
        return ResponseEntity.ok(responseMapper.toCommentResponses(commentService.listComments(postId)));
    }

    @DeleteMapping("/comments/{commentId}")
    public ResponseEntity<Void> deleteComment(HttpServletRequest request, @PathVariable Long commentId) {
        commentService.deleteComment(walletAuthenticator.authenticatedWallet(request), commentId);
        return ResponseEntity.noContent().build();
    }
}
