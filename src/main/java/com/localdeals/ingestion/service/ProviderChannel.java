package com.localdeals.ingestion.service;

/**
 * Outbound call budgets tracked by {@link ProviderRateLimiter}
 */
public enum ProviderChannel {
    PRIMARY,
    SECONDARY,
    WEBSITE
}
