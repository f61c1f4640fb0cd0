package com.localdeals.ingestion.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Google Place Details response, reduced to the fields the merge uses
 */
@Getter
@Builder
public class PlaceDetail {

    private final String placeId;
    private final String name;
    private final String formattedAddress;
    private final String phoneNumber;
    private final String website;
    private final Double latitude;
    private final Double longitude;
    private final Double rating;
    private final Integer userRatingsTotal;
    private final Integer priceLevel;

    @Builder.Default
    private final List<String> types = List.of();

    private final String photoReference;

    /** Raw {@code opening_hours} object serialized back to JSON. */
    private final String openingHoursJson;

    private final String editorialSummary;
    private final String mapsUrl;

    @Builder.Default
    private final List<ReviewItem> reviews = List.of();

    /**
     * A valid detail response always carries an address or a website; when both
     * are missing the provider returned a truncated payload.
     */
    public boolean isComplete() {
        return hasText(formattedAddress) || hasText(website);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return String.format("PlaceDetail{placeId='%s', name='%s', rating=%s}", placeId, name, rating);
    }
}
