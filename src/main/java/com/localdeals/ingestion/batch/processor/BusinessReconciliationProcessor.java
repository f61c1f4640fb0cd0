package com.localdeals.ingestion.batch.processor;

import com.localdeals.ingestion.dto.CanonicalBusiness;
import com.localdeals.ingestion.dto.PlaceDetail;
import com.localdeals.ingestion.dto.PlaceSearchResult;
import com.localdeals.ingestion.dto.ProcessedBusiness;
import com.localdeals.ingestion.dto.ReviewItem;
import com.localdeals.ingestion.dto.ScrapedExtras;
import com.localdeals.ingestion.dto.SecondaryMatch;
import com.localdeals.ingestion.service.GooglePlacesApiService;
import com.localdeals.ingestion.service.PhotoCacheService;
import com.localdeals.ingestion.service.PlaceEnrichmentService;
import com.localdeals.ingestion.service.PlaceReconciliationService;
import com.localdeals.ingestion.service.WebsiteScraperService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns one bare search result into a canonical business: details, photo, secondary
 * enrichment and website extras, then the field merge. Only authentication failures
 * escape; every other provider problem degrades the record instead of dropping it.
 */
@Component
public class BusinessReconciliationProcessor implements ItemProcessor<PlaceSearchResult, ProcessedBusiness> {

    private static final Logger logger = LoggerFactory.getLogger(BusinessReconciliationProcessor.class);

    private final GooglePlacesApiService googlePlacesApiService;
    private final PhotoCacheService photoCacheService;
    private final PlaceEnrichmentService enrichmentService;
    private final WebsiteScraperService websiteScraperService;
    private final PlaceReconciliationService reconciliationService;
    private final MeterRegistry meterRegistry;

    public BusinessReconciliationProcessor(
            GooglePlacesApiService googlePlacesApiService,
            PhotoCacheService photoCacheService,
            PlaceEnrichmentService enrichmentService,
            WebsiteScraperService websiteScraperService,
            PlaceReconciliationService reconciliationService,
            MeterRegistry meterRegistry
    ) {
        this.googlePlacesApiService = googlePlacesApiService;
        this.photoCacheService = photoCacheService;
        this.enrichmentService = enrichmentService;
        this.websiteScraperService = websiteScraperService;
        this.reconciliationService = reconciliationService;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public ProcessedBusiness process(PlaceSearchResult item) {
        long startTime = System.currentTimeMillis();
        logger.debug("🔄 Processing {} '{}'", item.getPlaceId(), item.getName());

        PlaceDetail detail = googlePlacesApiService.fetchDetailsWithRetry(item.getPlaceId()).orElse(null);
        if (detail == null) {
            meterRegistry.counter("business_processor_details_missing").increment();
        }

        String photoReference = reconciliationService.selectPhotoReference(detail, item);
        String photoPath = photoCacheService.fetch(photoReference, item.getPlaceId());

        Double latitude = detail != null && detail.getLatitude() != null ? detail.getLatitude() : item.getLatitude();
        Double longitude = detail != null && detail.getLongitude() != null ? detail.getLongitude() : item.getLongitude();
        Optional<SecondaryMatch> secondary = enrichmentService.lookup(item.getName(), latitude, longitude);
        if (secondary.isPresent()) {
            meterRegistry.counter("business_processor_secondary_matched").increment();
        }

        String website = reconciliationService.resolveWebsite(detail, secondary.orElse(null));
        ScrapedExtras extras = websiteScraperService.fetch(website).orElse(null);

        CanonicalBusiness business = reconciliationService.merge(detail, item, secondary.orElse(null), extras, photoPath);
        List<ReviewItem> reviews = detail != null && detail.getReviews() != null ? detail.getReviews() : List.of();

        meterRegistry.counter("business_processor_processed").increment();
        logger.info("🏪 Reconciled '{}' ({}): phone={}, website={}, secondary={}, extras={} in {}ms",
                business.getName(), business.getExternalPrimaryId(), business.getPhone(), business.getWebsiteUrl(),
                secondary.isPresent(), extras != null, System.currentTimeMillis() - startTime);

        return new ProcessedBusiness(business, reviews, extras);
    }
}
