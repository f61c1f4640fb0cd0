package com.localdeals.ingestion.repository;

import com.localdeals.ingestion.dto.CanonicalBusiness;
import com.localdeals.ingestion.dto.ReviewItem;
import com.localdeals.ingestion.dto.ScrapedExtras;

import java.util.List;

/**
 * Write side of the business store. The upsert is the only idempotent write;
 * reviews and deals are append-only.
 */
public interface BusinessWriteRepository {

    int MAX_REVIEWS = 5;
    int MAX_MENU_LINKS = 3;

    /**
     * Inserts or fully overwrites the row for the business's Google place id.
     * @return the stable internal id in both cases
     */
    long upsertBusiness(CanonicalBusiness business);

    /**
     * Appends the first {@link #MAX_REVIEWS} reviews in the given order.
     * @return number of rows written
     */
    int appendReviews(long businessId, List<ReviewItem> reviews);

    /**
     * Appends one offer from the category table, valid for the configured window from today.
     */
    void appendOffer(long businessId, String category);

    void upsertExtras(long businessId, ScrapedExtras extras);
}
