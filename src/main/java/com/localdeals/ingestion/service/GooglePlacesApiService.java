package com.localdeals.ingestion.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.localdeals.ingestion.batch.RunContext;
import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.PlaceDetail;
import com.localdeals.ingestion.dto.PlaceSearchPage;
import com.localdeals.ingestion.dto.PlaceSearchResult;
import com.localdeals.ingestion.dto.ReviewItem;
import com.localdeals.ingestion.exception.IngestionConfigurationException;
import com.localdeals.ingestion.exception.ProviderAuthenticationException;
import com.localdeals.ingestion.exception.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriBuilder;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Google Places API client: paged nearby search, place details and photo URLs.
 * Calls block; the batch thread processes one place at a time.
 */
@Service
public class GooglePlacesApiService {

    private static final Logger logger = LoggerFactory.getLogger(GooglePlacesApiService.class);

    static final String PROVIDER = "google-places";

    private static final String DETAIL_FIELDS = "place_id,name,formatted_address,geometry," +
            "formatted_phone_number,website,types,rating,user_ratings_total,price_level," +
            "opening_hours,editorial_summary,url,photos,reviews";

    private final WebClient webClient;
    private final ProviderRateLimiter rateLimiter;
    private final String googleApiKey;
    private final IngestionProperties.Primary settings;

    public GooglePlacesApiService(
            WebClient webClient,
            ProviderRateLimiter rateLimiter,
            IngestionProperties properties,
            @Value("${PRIMARY_API_KEY}") String googleApiKey
    ) {
        if (googleApiKey == null || googleApiKey.isBlank()) {
            throw new IngestionConfigurationException("PRIMARY_API_KEY must be set");
        }
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
        this.googleApiKey = googleApiKey;
        this.settings = properties.getPrimary();
    }

    /**
     * Nearby search around the run's center. With a page token only the token is sent,
     * as the provider requires.
     * @param runContext center and radius of the current run
     * @param category Google place type
     * @param pageToken token from the previous page, or null for the first page
     * @return one page of bare results
     */
    public PlaceSearchPage searchNearby(RunContext runContext, String category, String pageToken) {
        boolean tokenCall = pageToken != null && !pageToken.isBlank();
        logger.debug("🗺️ Nearby search '{}' at {},{} within {}m (token: {})", category,
                runContext.getCenterLatitude(), runContext.getCenterLongitude(),
                runContext.getRadiusMeters(), tokenCall);

        JsonNode response = fetchJson(uriBuilder -> {
            UriBuilder builder = uriBuilder
                    .scheme("https")
                    .host("maps.googleapis.com")
                    .path("/maps/api/place/nearbysearch/json")
                    .queryParam("key", googleApiKey);

            if (tokenCall) {
                builder.queryParam("pagetoken", pageToken);
            } else {
                builder.queryParam("location", runContext.getCenterLatitude() + "," + runContext.getCenterLongitude())
                        .queryParam("radius", runContext.getRadiusMeters())
                        .queryParam("type", category);
            }
            return builder.build();
        }, "nearby search '" + category + "'");

        String status = response.path("status").asText();
        if ("ZERO_RESULTS".equals(status)) {
            return PlaceSearchPage.empty();
        }
        checkStatus(status, response, tokenCall ? "page token for '" + category + "'" : "nearby search '" + category + "'");

        List<PlaceSearchResult> results = new ArrayList<>();
        JsonNode resultsNode = response.path("results");
        if (resultsNode.isArray()) {
            for (JsonNode result : resultsNode) {
                PlaceSearchResult parsed = parseSearchResult(result);
                if (parsed != null) {
                    results.add(parsed);
                }
            }
        } else {
            logger.warn("Results field is not an array for '{}'", category);
        }

        String nextPageToken = textOrNull(response, "next_page_token");
        logger.debug("Parsed {} results for '{}' (next page: {})", results.size(), category, nextPageToken != null);
        return new PlaceSearchPage(results, nextPageToken);
    }

    /**
     * Single Place Details call.
     * @param placeId Google place id
     * @return detail, or empty when the provider has no result for the id
     */
    public Optional<PlaceDetail> getPlaceDetails(String placeId) {
        logger.debug("📍 Fetching Google Place details for ID: {}", placeId);

        JsonNode response = fetchJson(uriBuilder -> uriBuilder
                .scheme("https")
                .host("maps.googleapis.com")
                .path("/maps/api/place/details/json")
                .queryParam("place_id", placeId)
                .queryParam("fields", DETAIL_FIELDS)
                .queryParam("key", googleApiKey)
                .build(), "details for " + placeId);

        String status = response.path("status").asText();
        if ("NOT_FOUND".equals(status) || "ZERO_RESULTS".equals(status)) {
            logger.debug("No details for place {} ({})", placeId, status);
            return Optional.empty();
        }
        checkStatus(status, response, "details for " + placeId);

        JsonNode result = response.path("result");
        if (result.isMissingNode() || !result.isObject()) {
            return Optional.empty();
        }
        return Optional.of(parseDetail(result, placeId));
    }

    /**
     * Details with the incomplete-response retry budget. Transient failures and payloads
     * missing both address and website count as failed attempts. Once the budget is spent
     * the caller gets an empty result and keeps the bare search fields.
     */
    public Optional<PlaceDetail> fetchDetailsWithRetry(String placeId) {
        int attempts = Math.max(1, settings.getDetailAttempts());

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                Optional<PlaceDetail> detail = getPlaceDetails(placeId);
                if (detail.isPresent() && detail.get().isComplete()) {
                    return detail;
                }
                logger.warn("⚠️ Incomplete details for {} (attempt {}/{})", placeId, attempt, attempts);
            } catch (TransientProviderException e) {
                logger.warn("⚠️ Transient failure fetching details for {} (attempt {}/{}): {}",
                        placeId, attempt, attempts, e.getMessage());
            }

            if (attempt < attempts) {
                rateLimiter.pause(settings.getDetailRetryDelay());
            }
        }

        logger.warn("Giving up on details for {} after {} attempts, keeping search result fields only",
                placeId, attempts);
        return Optional.empty();
    }

    /**
     * Photo endpoint URL for a photo reference
     * @param photoReference Google Places photo reference
     * @param maxWidth maximum width in pixels
     * @return URL, or null without a reference
     */
    public String getPhotoUrl(String photoReference, int maxWidth) {
        if (photoReference == null || photoReference.trim().isEmpty()) {
            return null;
        }

        return UriComponentsBuilder.fromHttpUrl("https://maps.googleapis.com/maps/api/place/photo")
                .queryParam("maxwidth", maxWidth)
                .queryParam("photo_reference", photoReference)
                .queryParam("key", googleApiKey)
                .encode()
                .build()
                .toUriString();
    }

    private JsonNode fetchJson(Function<UriBuilder, URI> uriFunction, String description) {
        rateLimiter.acquire(ProviderChannel.PRIMARY);

        JsonNode body;
        try {
            body = webClient.get()
                    .uri(uriFunction)
                    .retrieve()
                    .onStatus(status -> status.value() == 401 || status.value() == 403,
                            response -> Mono.error(new ProviderAuthenticationException(PROVIDER,
                                    "HTTP " + response.statusCode().value() + " for " + description)))
                    .onStatus(status -> status.is5xxServerError() || status.value() == 429,
                            response -> Mono.error(new TransientProviderException(PROVIDER,
                                    "HTTP " + response.statusCode().value() + " for " + description)))
                    .bodyToMono(JsonNode.class)
                    .retryWhen(Retry.backoff(settings.getTransportRetries(), settings.getTransportBackoff())
                            .maxBackoff(Duration.ofSeconds(10))
                            .filter(TransientProviderException.class::isInstance)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure())
                            .doBeforeRetry(retrySignal ->
                                    logger.warn("Retrying Google Places call ({}), attempt: {}",
                                            description, retrySignal.totalRetries() + 1)))
                    .block(settings.getRequestTimeout());
        } catch (ProviderAuthenticationException | TransientProviderException e) {
            throw e;
        } catch (WebClientException e) {
            throw new TransientProviderException(PROVIDER, "Request failed for " + description + ": " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) signals a timeout this way
            throw new TransientProviderException(PROVIDER, "Timed out for " + description, e);
        }

        if (body == null) {
            throw new TransientProviderException(PROVIDER, "Empty response for " + description);
        }
        return body;
    }

    private void checkStatus(String status, JsonNode response, String description) {
        if ("OK".equals(status)) {
            return;
        }

        String errorMessage = response.path("error_message").asText("");
        if ("REQUEST_DENIED".equals(status)) {
            logger.error("❌ Google Places denied {}: {}", description, errorMessage);
            throw new ProviderAuthenticationException(PROVIDER, "REQUEST_DENIED for " + description + ": " + errorMessage);
        }
        if ("OVER_QUERY_LIMIT".equals(status)) {
            logger.error("Google Places API quota exceeded!");
        }
        // INVALID_REQUEST on a token call means the token is not active yet
        throw new TransientProviderException(PROVIDER, status + " for " + description);
    }

    private PlaceSearchResult parseSearchResult(JsonNode node) {
        String placeId = textOrNull(node, "place_id");
        if (placeId == null) {
            logger.debug("Skipping search result without place_id");
            return null;
        }

        JsonNode location = node.path("geometry").path("location");
        return PlaceSearchResult.builder()
                .placeId(placeId)
                .name(textOrNull(node, "name"))
                .vicinity(textOrNull(node, "vicinity"))
                .latitude(doubleOrNull(location, "lat"))
                .longitude(doubleOrNull(location, "lng"))
                .rating(doubleOrNull(node, "rating"))
                .userRatingsTotal(intOrNull(node, "user_ratings_total"))
                .priceLevel(intOrNull(node, "price_level"))
                .types(parseTypes(node))
                .photoReference(firstPhotoReference(node))
                .build();
    }

    private PlaceDetail parseDetail(JsonNode node, String requestedPlaceId) {
        JsonNode location = node.path("geometry").path("location");
        JsonNode openingHours = node.path("opening_hours");

        List<ReviewItem> reviews = new ArrayList<>();
        JsonNode reviewsNode = node.path("reviews");
        if (reviewsNode.isArray()) {
            for (JsonNode review : reviewsNode) {
                reviews.add(ReviewItem.builder()
                        .authorName(textOrNull(review, "author_name"))
                        .rating(intOrNull(review, "rating"))
                        .text(textOrNull(review, "text"))
                        .relativeTime(textOrNull(review, "relative_time_description"))
                        .build());
            }
        }

        String placeId = textOrNull(node, "place_id");
        return PlaceDetail.builder()
                .placeId(placeId != null ? placeId : requestedPlaceId)
                .name(textOrNull(node, "name"))
                .formattedAddress(textOrNull(node, "formatted_address"))
                .phoneNumber(textOrNull(node, "formatted_phone_number"))
                .website(textOrNull(node, "website"))
                .latitude(doubleOrNull(location, "lat"))
                .longitude(doubleOrNull(location, "lng"))
                .rating(doubleOrNull(node, "rating"))
                .userRatingsTotal(intOrNull(node, "user_ratings_total"))
                .priceLevel(intOrNull(node, "price_level"))
                .types(parseTypes(node))
                .photoReference(firstPhotoReference(node))
                .openingHoursJson(openingHours.isObject() ? openingHours.toString() : null)
                .editorialSummary(textOrNull(node.path("editorial_summary"), "overview"))
                .mapsUrl(textOrNull(node, "url"))
                .reviews(reviews)
                .build();
    }

    private List<String> parseTypes(JsonNode node) {
        List<String> types = new ArrayList<>();
        JsonNode typesNode = node.path("types");
        if (typesNode.isArray()) {
            for (JsonNode type : typesNode) {
                types.add(type.asText());
            }
        }
        return types;
    }

    private String firstPhotoReference(JsonNode node) {
        JsonNode photos = node.path("photos");
        if (photos.isArray() && photos.size() > 0) {
            return textOrNull(photos.get(0), "photo_reference");
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : null;
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asInt() : null;
    }
}
