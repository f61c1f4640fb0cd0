package com.localdeals.ingestion.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Normalized top hit from the Yelp business search
 */
@Getter
@Builder
@ToString
public class SecondaryMatch {

    private final String externalId;
    private final String alias;
    private final String phone;
    private final String website;

    /** Number of {@code $} signs in Yelp's price field. */
    private final Integer priceTier;

    private final String streetAddress;
}
