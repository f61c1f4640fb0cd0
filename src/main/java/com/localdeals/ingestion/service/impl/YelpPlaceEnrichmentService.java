package com.localdeals.ingestion.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.SecondaryMatch;
import com.localdeals.ingestion.service.PlaceEnrichmentService;
import com.localdeals.ingestion.service.ProviderChannel;
import com.localdeals.ingestion.service.ProviderRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;

/**
 * Yelp Fusion business search used to fill gaps left by Google.
 * The top-ranked hit is accepted as the match; there is no similarity threshold.
 */
@Service
public class YelpPlaceEnrichmentService implements PlaceEnrichmentService {

    private static final Logger logger = LoggerFactory.getLogger(YelpPlaceEnrichmentService.class);

    private final WebClient webClient;
    private final ProviderRateLimiter rateLimiter;
    private final String yelpApiKey;
    private final Duration requestTimeout;

    public YelpPlaceEnrichmentService(
            WebClient webClient,
            ProviderRateLimiter rateLimiter,
            IngestionProperties properties,
            @Value("${SECONDARY_API_KEY:}") String yelpApiKey
    ) {
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
        this.yelpApiKey = yelpApiKey;
        this.requestTimeout = properties.getSecondary().getRequestTimeout();

        if (!isEnabled()) {
            logger.info("SECONDARY_API_KEY not set, Yelp enrichment disabled");
        }
    }

    @Override
    public boolean isEnabled() {
        return yelpApiKey != null && !yelpApiKey.isBlank();
    }

    @Override
    public Optional<SecondaryMatch> lookup(String name, Double latitude, Double longitude) {
        if (!isEnabled() || name == null || name.isBlank() || latitude == null || longitude == null) {
            return Optional.empty();
        }

        try {
            rateLimiter.acquire(ProviderChannel.SECONDARY);

            JsonNode response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .scheme("https")
                            .host("api.yelp.com")
                            .path("/v3/businesses/search")
                            .queryParam("term", name)
                            .queryParam("latitude", latitude)
                            .queryParam("longitude", longitude)
                            .queryParam("limit", 1)
                            .build())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + yelpApiKey)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(requestTimeout);

            if (response == null) {
                return Optional.empty();
            }

            JsonNode businesses = response.path("businesses");
            if (!businesses.isArray() || businesses.size() == 0) {
                logger.debug("No Yelp match for '{}'", name);
                return Optional.empty();
            }

            SecondaryMatch match = parseBusiness(businesses.get(0));
            logger.debug("Yelp match for '{}': {} ({}, price tier {})",
                    name, match.getExternalId(), match.getAlias(), match.getPriceTier());
            return Optional.of(match);

        } catch (Exception e) {
            logger.warn("⚠️ Yelp lookup failed for '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private SecondaryMatch parseBusiness(JsonNode business) {
        String price = textOrNull(business, "price");
        return SecondaryMatch.builder()
                .externalId(textOrNull(business, "id"))
                .alias(textOrNull(business, "alias"))
                .phone(textOrNull(business, "display_phone"))
                .website(textOrNull(business, "url"))
                .priceTier(price != null ? Integer.valueOf(price.length()) : null)
                .streetAddress(textOrNull(business.path("location"), "address1"))
                .build();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
