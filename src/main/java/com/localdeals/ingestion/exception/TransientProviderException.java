package com.localdeals.ingestion.exception;

/**
 * Retryable provider failure: rate limiting, 5xx, or a page token that is not active yet
 */
public class TransientProviderException extends RuntimeException {

    private final String provider;

    public TransientProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public TransientProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
