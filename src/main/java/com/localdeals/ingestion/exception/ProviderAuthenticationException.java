package com.localdeals.ingestion.exception;

/**
 * The provider rejected our credentials. Retrying cannot help, so the whole run stops;
 * rows committed before this point stay in the store.
 */
public class ProviderAuthenticationException extends RuntimeException {

    private final String provider;

    public ProviderAuthenticationException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
