package com.localdeals.ingestion.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Bare search result from a Google Places nearby search page.
 * Lighter than {@link PlaceDetail}; every field except the place id may be missing.
 */
@Getter
@Builder
public class PlaceSearchResult {

    private final String placeId;
    private final String name;
    private final String vicinity;
    private final Double latitude;
    private final Double longitude;
    private final Double rating;
    private final Integer userRatingsTotal;
    private final Integer priceLevel;

    @Builder.Default
    private final List<String> types = List.of();

    private final String photoReference;

    @Override
    public String toString() {
        return String.format("PlaceSearchResult{placeId='%s', name='%s'}", placeId, name);
    }
}
