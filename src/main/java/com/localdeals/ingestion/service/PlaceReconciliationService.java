package com.localdeals.ingestion.service;

import com.localdeals.ingestion.dto.CanonicalBusiness;
import com.localdeals.ingestion.dto.PlaceDetail;
import com.localdeals.ingestion.dto.PlaceSearchResult;
import com.localdeals.ingestion.dto.ScrapedExtras;
import com.localdeals.ingestion.dto.SecondaryMatch;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

import static com.localdeals.ingestion.dto.CanonicalBusiness.UNKNOWN_MARKER;
import static com.localdeals.ingestion.dto.CanonicalBusiness.isKnown;

/**
 * Merges the provider records for one place into a {@link CanonicalBusiness}.
 * Every field has a fixed priority list and the first present value wins.
 * No I/O happens here; the photo path is resolved by the caller.
 */
@Service
public class PlaceReconciliationService {

    /**
     * @param detail    Google details, null when the detail fetch degraded
     * @param bare      nearby search result the place was discovered through
     * @param secondary Yelp match, may be null
     * @param extras    scraped website extras, may be null (persisted separately, not merged)
     * @param photoPath photo cache path or placeholder
     */
    public CanonicalBusiness merge(PlaceDetail detail, PlaceSearchResult bare, SecondaryMatch secondary,
                                   ScrapedExtras extras, String photoPath) {
        return CanonicalBusiness.builder()
                .externalPrimaryId(bare.getPlaceId())
                .externalSecondaryId(secondary != null ? secondary.getExternalId() : null)
                // bare name is stable across detail retries
                .name(firstPresent(bare.getName(), detail != null ? detail.getName() : null))
                .address(firstPresent(
                        detail != null ? detail.getFormattedAddress() : null,
                        bare.getVicinity(),
                        secondary != null ? secondary.getStreetAddress() : null))
                .phone(resolvePhone(detail, secondary))
                .websiteUrl(resolveWebsite(detail, secondary))
                .latitude(firstPresent(detail != null ? detail.getLatitude() : null, bare.getLatitude()))
                .longitude(firstPresent(detail != null ? detail.getLongitude() : null, bare.getLongitude()))
                .category(firstPresent(
                        detail != null ? firstType(detail.getTypes()) : null,
                        firstType(bare.getTypes())))
                .rating(firstPresent(detail != null ? detail.getRating() : null, bare.getRating()))
                .ratingCount(firstPresent(detail != null ? detail.getUserRatingsTotal() : null, bare.getUserRatingsTotal()))
                .priceLevel(firstPresent(detail != null ? detail.getPriceLevel() : null, bare.getPriceLevel()))
                .openingHours(value(detail, PlaceDetail::getOpeningHoursJson))
                .description(value(detail, PlaceDetail::getEditorialSummary))
                .mapsUrl(value(detail, PlaceDetail::getMapsUrl))
                .photoPath(photoPath)
                .build();
    }

    /**
     * Website the merge will keep; the scraper targets the same URL.
     */
    public String resolveWebsite(PlaceDetail detail, SecondaryMatch secondary) {
        return contact(detail != null ? detail.getWebsite() : null,
                secondary != null ? secondary.getWebsite() : null);
    }

    public String resolvePhone(PlaceDetail detail, SecondaryMatch secondary) {
        return contact(detail != null ? detail.getPhoneNumber() : null,
                secondary != null ? secondary.getPhone() : null);
    }

    /**
     * Detail's first photo reference, then the search result's.
     */
    public String selectPhotoReference(PlaceDetail detail, PlaceSearchResult bare) {
        return firstPresent(detail != null ? detail.getPhotoReference() : null, bare.getPhotoReference());
    }

    private String contact(String primaryValue, String secondaryValue) {
        if (isKnown(primaryValue)) {
            return primaryValue;
        }
        if (isKnown(secondaryValue)) {
            return secondaryValue;
        }
        return UNKNOWN_MARKER;
    }

    private static String firstType(List<String> types) {
        return types == null || types.isEmpty() ? null : types.get(0);
    }

    private static <T> T value(PlaceDetail detail, Function<PlaceDetail, T> getter) {
        return detail != null ? getter.apply(detail) : null;
    }

    @SafeVarargs
    private static <T> T firstPresent(T... candidates) {
        for (T candidate : candidates) {
            if (candidate instanceof String) {
                if (!((String) candidate).isBlank()) {
                    return candidate;
                }
            } else if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
