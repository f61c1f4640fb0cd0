package com.localdeals.ingestion.dto;

import lombok.Builder;
import lombok.Getter;

/**
 * Reconciled business, one per Google place id.
 * Phone and website carry {@link #UNKNOWN_MARKER} instead of null when no source had them.
 */
@Getter
@Builder
public class CanonicalBusiness {

    public static final String UNKNOWN_MARKER = "N/A";

    private final String externalPrimaryId;
    private final String externalSecondaryId;
    private final String name;
    private final String address;
    private final String phone;
    private final String websiteUrl;
    private final Double latitude;
    private final Double longitude;
    private final String category;
    private final Double rating;
    private final Integer ratingCount;
    private final Integer priceLevel;
    private final String openingHours;
    private final String description;
    private final String photoPath;
    private final String mapsUrl;

    public static boolean isKnown(String value) {
        return value != null && !value.isBlank() && !UNKNOWN_MARKER.equalsIgnoreCase(value.trim());
    }

    @Override
    public String toString() {
        return String.format("CanonicalBusiness{placeId='%s', name='%s', category='%s'}",
                externalPrimaryId, name, category);
    }
}
