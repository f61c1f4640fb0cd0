package com.localdeals.ingestion.dto;

import java.util.List;

/**
 * Output of the reconciliation step: the merged business plus the child rows written with it
 */
public class ProcessedBusiness {

    private final CanonicalBusiness business;
    private final List<ReviewItem> reviews;
    private final ScrapedExtras extras;

    public ProcessedBusiness(CanonicalBusiness business, List<ReviewItem> reviews, ScrapedExtras extras) {
        this.business = business;
        this.reviews = reviews != null ? List.copyOf(reviews) : List.of();
        this.extras = extras;
    }

    public CanonicalBusiness getBusiness() { return business; }
    public List<ReviewItem> getReviews() { return reviews; }
    public ScrapedExtras getExtras() { return extras; }

    public boolean hasExtras() {
        return extras != null;
    }

    @Override
    public String toString() {
        return String.format("ProcessedBusiness{business='%s', reviews=%d, hasExtras=%s}",
                business != null ? business.getName() : "null", reviews.size(), hasExtras());
    }
}
