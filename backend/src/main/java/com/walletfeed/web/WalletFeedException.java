package com.walletfeed.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Client-visible rejection of a social action. Subclasses fix the status.
 */
@Getter
public abstract class WalletFeedException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected WalletFeedException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
