package com.walletfeed.ingestion.provider;

/**
 * Thrown when the history provider call fails (transport, non-2xx status or malformed payload).
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
