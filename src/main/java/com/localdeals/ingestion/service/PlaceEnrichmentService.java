package com.localdeals.ingestion.service;

import com.localdeals.ingestion.dto.SecondaryMatch;

import java.util.Optional;

/**
 * Best-effort enrichment from the secondary provider
 */
public interface PlaceEnrichmentService {

    /**
     * Looks up the business by name near the given coordinate.
     * Never throws: not-found, transport and auth failures all come back as empty.
     */
    Optional<SecondaryMatch> lookup(String name, Double latitude, Double longitude);

    boolean isEnabled();
}
