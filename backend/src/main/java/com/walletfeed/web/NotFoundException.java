package com.walletfeed.web;

import org.springframework.http.HttpStatus;

public class NotFoundException extends WalletFeedException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "not_found", message);
    }

    public static NotFoundException post(Long postId) {
        return new NotFoundException("Post not found: " + postId);
    }

    public static NotFoundException comment(Long commentId) {
        return new NotFoundException("Comment not found: " + commentId);
    }

    public static NotFoundException wallet(String wallet) {
        return new NotFoundException("Wallet not found: " + wallet);
    }
}
