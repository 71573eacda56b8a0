package com.walletfeed.web;

import org.springframework.http.HttpStatus;

public class UnauthenticatedException extends WalletFeedException {

    public UnauthenticatedException(String message) {
        super(HttpStatus.UNAUTHORIZED, "unauthenticated", message);
    }
}
