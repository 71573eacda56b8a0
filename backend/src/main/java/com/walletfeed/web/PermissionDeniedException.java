package com.walletfeed.web;

import org.springframework.http.HttpStatus;

public class PermissionDeniedException extends WalletFeedException {

    public PermissionDeniedException(String message) {
        super(HttpStatus.FORBIDDEN, "permission_denied", message);
    }
}
