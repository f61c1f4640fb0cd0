package com.localdeals.ingestion.exception;

/**
 * Required configuration is missing or unusable at startup
 */
public class IngestionConfigurationException extends RuntimeException {

    public IngestionConfigurationException(String message) {
        super(message);
    }
}
