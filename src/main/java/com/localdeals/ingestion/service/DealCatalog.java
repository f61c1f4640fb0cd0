package com.localdeals.ingestion.service;

import com.localdeals.ingestion.config.IngestionProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Category to promotional-offer table, loaded from {@code ingestion.deals}.
 */
@Component
public class DealCatalog {

    private final Map<String, IngestionProperties.Offer> offers;
    private final IngestionProperties.Offer fallback;
    private final int validityDays;

    public DealCatalog(IngestionProperties properties) {
        IngestionProperties.Deals deals = properties.getDeals();
        this.offers = Map.copyOf(deals.getOffers());
        this.fallback = deals.getFallback();
        this.validityDays = deals.getValidityDays();
    }

    /**
     * Configured offer for the category, or the generic fallback for unknown categories.
     */
    public IngestionProperties.Offer offerFor(String category) {
        if (category == null) {
            return fallback;
        }
        IngestionProperties.Offer offer = offers.get(category.toLowerCase(Locale.ROOT));
        return offer != null ? offer : fallback;
    }

    public int getValidityDays() {
        return validityDays;
    }
}
