package com.localdeals.ingestion.service;

import com.localdeals.ingestion.batch.RunContext;
import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.PlaceDetail;
import com.localdeals.ingestion.dto.PlaceSearchPage;
import com.localdeals.ingestion.exception.IngestionConfigurationException;
import com.localdeals.ingestion.exception.ProviderAuthenticationException;
import com.localdeals.ingestion.exception.TransientProviderException;
import com.localdeals.ingestion.support.RecordingSleeper;
import com.localdeals.ingestion.support.StubExchangeFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GooglePlacesApiServiceTest {

    private static final String SEARCH_PAGE = """
            {
              "status": "OK",
              "next_page_token": "TOKEN-2",
              "results": [
                {
                  "place_id": "p1",
                  "name": "Cafe One",
                  "vicinity": "1 Main St",
                  "geometry": {"location": {"lat": 47.76, "lng": -122.2}},
                  "rating": 4.5,
                  "user_ratings_total": 10,
                  "types": ["cafe", "food"],
                  "photos": [{"photo_reference": "ref-1"}]
                },
                {"name": "No id, skipped"},
                {"place_id": "p2", "name": "Cafe Two"}
              ]
            }
            """;

    private static final String COMPLETE_DETAIL = """
            {
              "status": "OK",
              "result": {
                "place_id": "p1",
                "name": "Cafe One",
                "formatted_address": "1 Main St, Bothell, WA",
                "formatted_phone_number": "(425) 555-0101",
                "website": "https://cafe-one.example",
                "opening_hours": {"open_now": true},
                "editorial_summary": {"overview": "Cozy corner cafe."},
                "url": "https://maps.google.com/?cid=1",
                "reviews": [
                  {"author_name": "Ann", "rating": 5, "text": "Great", "relative_time_description": "a week ago"}
                ]
              }
            }
            """;

    private static final String INCOMPLETE_DETAIL = """
            {"status": "OK", "result": {"place_id": "p1", "name": "Cafe One"}}
            """;

    private StubExchangeFunction exchange;
    private RecordingSleeper sleeper;
    private IngestionProperties properties;
    private RunContext runContext;

    @BeforeEach
    void setUp() {
        exchange = new StubExchangeFunction();
        sleeper = new RecordingSleeper();
        properties = new IngestionProperties();
        properties.getPrimary().setTransportRetries(0);
        properties.getPrimary().setTransportBackoff(Duration.ofMillis(1));
        runContext = new RunContext(47.7599, -122.2050, 3000, List.of("cafe"), 10);
    }

    private GooglePlacesApiService service() {
        ProviderRateLimiter rateLimiter = new ProviderRateLimiter(Map.of(), Clock.systemUTC(), sleeper);
        return new GooglePlacesApiService(exchange.webClient(), rateLimiter, properties, "test-key");
    }

    @Test
    void searchNearby_firstPageSendsLocationAndParsesResults() {
        exchange.json(SEARCH_PAGE);

        PlaceSearchPage page = service().searchNearby(runContext, "cafe", null);

        assertThat(page.getResults()).hasSize(2);
        assertThat(page.getResults().get(0).getPlaceId()).isEqualTo("p1");
        assertThat(page.getResults().get(0).getLatitude()).isEqualTo(47.76);
        assertThat(page.getResults().get(0).getTypes()).containsExactly("cafe", "food");
        assertThat(page.getResults().get(0).getPhotoReference()).isEqualTo("ref-1");
        assertThat(page.getNextPageToken()).isEqualTo("TOKEN-2");
        assertThat(page.hasNextPage()).isTrue();

        String query = exchange.lastUri().getQuery();
        assertThat(exchange.lastUri().getPath()).isEqualTo("/maps/api/place/nearbysearch/json");
        assertThat(query).contains("type=cafe").contains("radius=3000").contains("location=47.7599")
                .doesNotContain("pagetoken");
    }

    @Test
    void searchNearby_tokenCallSendsOnlyToken() {
        exchange.json("{\"status\": \"OK\", \"results\": []}");

        PlaceSearchPage page = service().searchNearby(runContext, "cafe", "TOKEN-2");

        assertThat(page.getResults()).isEmpty();
        assertThat(page.hasNextPage()).isFalse();
        String query = exchange.lastUri().getQuery();
        assertThat(query).contains("pagetoken=TOKEN-2").contains("key=test-key")
                .doesNotContain("location").doesNotContain("type=");
    }

    @Test
    void searchNearby_zeroResultsIsEmptyPage() {
        exchange.json("{\"status\": \"ZERO_RESULTS\", \"results\": []}");

        PlaceSearchPage page = service().searchNearby(runContext, "bar", null);

        assertThat(page.getResults()).isEmpty();
        assertThat(page.hasNextPage()).isFalse();
    }

    @Test
    void searchNearby_requestDeniedIsFatal() {
        exchange.json("{\"status\": \"REQUEST_DENIED\", \"error_message\": \"The provided API key is invalid.\"}");

        assertThatThrownBy(() -> service().searchNearby(runContext, "cafe", null))
                .isInstanceOf(ProviderAuthenticationException.class)
                .hasMessageContaining("REQUEST_DENIED")
                .hasFieldOrPropertyWithValue("provider", "google-places");
    }

    @Test
    void searchNearby_invalidRequestOnTokenIsTransient() {
        exchange.json("{\"status\": \"INVALID_REQUEST\"}");

        assertThatThrownBy(() -> service().searchNearby(runContext, "cafe", "NOT-YET-ACTIVE"))
                .isInstanceOf(TransientProviderException.class)
                .hasFieldOrPropertyWithValue("provider", "google-places");
    }

    @Test
    void httpForbiddenIsFatal() {
        exchange.respond(HttpStatus.FORBIDDEN, "{}");

        assertThatThrownBy(() -> service().searchNearby(runContext, "cafe", null))
                .isInstanceOf(ProviderAuthenticationException.class);
    }

    @Test
    void httpServerErrorIsTransient() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        assertThatThrownBy(() -> service().getPlaceDetails("p1"))
                .isInstanceOf(TransientProviderException.class);
    }

    @Test
    void getPlaceDetails_parsesDetailAndReviews() {
        exchange.json(COMPLETE_DETAIL);

        Optional<PlaceDetail> detail = service().getPlaceDetails("p1");

        assertThat(detail).isPresent();
        assertThat(detail.get().getFormattedAddress()).isEqualTo("1 Main St, Bothell, WA");
        assertThat(detail.get().getPhoneNumber()).isEqualTo("(425) 555-0101");
        assertThat(detail.get().getEditorialSummary()).isEqualTo("Cozy corner cafe.");
        assertThat(detail.get().getOpeningHoursJson()).contains("open_now");
        assertThat(detail.get().getReviews()).hasSize(1);
        assertThat(detail.get().getReviews().get(0).getRelativeTime()).isEqualTo("a week ago");
        assertThat(detail.get().isComplete()).isTrue();
    }

    @Test
    void getPlaceDetails_notFoundIsEmpty() {
        exchange.json("{\"status\": \"NOT_FOUND\"}");

        assertThat(service().getPlaceDetails("gone")).isEmpty();
    }

    @Test
    void fetchDetailsWithRetry_givesUpAfterThreeIncompleteResponses() {
        exchange.json(INCOMPLETE_DETAIL);

        Optional<PlaceDetail> detail = service().fetchDetailsWithRetry("p1");

        assertThat(detail).isEmpty();
        assertThat(exchange.getRequests()).hasSize(3);
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void fetchDetailsWithRetry_returnsFirstCompleteResponse() {
        exchange.json(INCOMPLETE_DETAIL).respond(HttpStatus.BAD_GATEWAY, "{}").json(COMPLETE_DETAIL);

        Optional<PlaceDetail> detail = service().fetchDetailsWithRetry("p1");

        assertThat(detail).isPresent();
        assertThat(detail.get().getWebsite()).isEqualTo("https://cafe-one.example");
        assertThat(exchange.getRequests()).hasSize(3);
    }

    @Test
    void fetchDetailsWithRetry_propagatesAuthenticationFailure() {
        exchange.respond(HttpStatus.UNAUTHORIZED, "{}");

        assertThatThrownBy(() -> service().fetchDetailsWithRetry("p1"))
                .isInstanceOf(ProviderAuthenticationException.class);
        assertThat(exchange.getRequests()).hasSize(1);
    }

    @Test
    void blankApiKeyFailsAtStartup() {
        ProviderRateLimiter rateLimiter = new ProviderRateLimiter(Map.of(), Clock.systemUTC(), sleeper);

        assertThatThrownBy(() -> new GooglePlacesApiService(exchange.webClient(), rateLimiter, properties, " "))
                .isInstanceOf(IngestionConfigurationException.class);
    }

    @Test
    void getPhotoUrl_includesReferenceAndWidth() {
        assertThat(service().getPhotoUrl("ref-1", 800))
                .contains("maxwidth=800")
                .contains("photo_reference=ref-1")
                .contains("key=test-key");
        assertThat(service().getPhotoUrl(" ", 800)).isNull();
    }

    @Test
    void getPhotoUrl_encodesReferenceIntoValidUri() {
        String url = service().getPhotoUrl("bad ref|x", 400);

        assertThat(URI.create(url).getQuery()).contains("photo_reference=bad ref|x");
        assertThat(url).contains("photo_reference=bad%20ref%7Cx");
    }
}
