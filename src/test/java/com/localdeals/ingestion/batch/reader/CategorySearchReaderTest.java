package com.localdeals.ingestion.batch.reader;

import com.localdeals.ingestion.batch.RunContext;
import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.PlaceSearchPage;
import com.localdeals.ingestion.dto.PlaceSearchResult;
import com.localdeals.ingestion.exception.ProviderAuthenticationException;
import com.localdeals.ingestion.exception.TransientProviderException;
import com.localdeals.ingestion.service.GooglePlacesApiService;
import com.localdeals.ingestion.service.ProviderRateLimiter;
import com.localdeals.ingestion.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CategorySearchReaderTest {

    @Mock
    private GooglePlacesApiService placesApiService;

    private RecordingSleeper sleeper;
    private IngestionProperties properties;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        properties = new IngestionProperties();
    }

    private CategorySearchReader reader(RunContext runContext) {
        ProviderRateLimiter rateLimiter = new ProviderRateLimiter(Map.of(), Clock.systemUTC(), sleeper);
        return new CategorySearchReader(placesApiService, rateLimiter, runContext, properties);
    }

    private static PlaceSearchPage page(String nextToken, String... placeIds) {
        List<PlaceSearchResult> results = Arrays.stream(placeIds)
                .map(id -> PlaceSearchResult.builder().placeId(id).name("Place " + id).build())
                .collect(Collectors.toList());
        return new PlaceSearchPage(results, nextToken);
    }

    private static List<String> drain(CategorySearchReader reader) {
        List<String> ids = new ArrayList<>();
        PlaceSearchResult item;
        while ((item = reader.read()) != null) {
            ids.add(item.getPlaceId());
        }
        return ids;
    }

    @Test
    void read_followsPagesWithTokenDelayThenNextCategory() {
        RunContext runContext = new RunContext(47.0, -122.0, 1000, List.of("restaurant", "cafe"), 100);
        when(placesApiService.searchNearby(any(RunContext.class), eq("restaurant"), isNull()))
                .thenReturn(page("T2", "r1", "r2"));
        when(placesApiService.searchNearby(any(RunContext.class), eq("restaurant"), eq("T2")))
                .thenReturn(page(null, "r3"));
        when(placesApiService.searchNearby(any(RunContext.class), eq("cafe"), isNull()))
                .thenReturn(page(null, "c1"));

        List<String> ids = drain(reader(runContext));

        assertThat(ids).containsExactly("r1", "r2", "r3", "c1");
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(1));
    }

    @Test
    void read_skipsPlacesAlreadySeenInEarlierCategory() {
        RunContext runContext = new RunContext(47.0, -122.0, 1000, List.of("restaurant", "bar"), 100);
        when(placesApiService.searchNearby(any(RunContext.class), eq("restaurant"), isNull()))
                .thenReturn(page(null, "p1", "p2"));
        when(placesApiService.searchNearby(any(RunContext.class), eq("bar"), isNull()))
                .thenReturn(page(null, "p2", "p3", "p3"));

        assertThat(drain(reader(runContext))).containsExactly("p1", "p2", "p3");
    }

    @Test
    void read_stopsWhenTargetReached() {
        RunContext runContext = new RunContext(47.0, -122.0, 1000, List.of("restaurant", "cafe"), 2);
        when(placesApiService.searchNearby(any(RunContext.class), eq("restaurant"), isNull()))
                .thenReturn(page("T2", "r1", "r2", "r3"));
        CategorySearchReader reader = reader(runContext);

        assertThat(reader.read().getPlaceId()).isEqualTo("r1");
        runContext.recordPersisted();
        assertThat(reader.read().getPlaceId()).isEqualTo("r2");
        runContext.recordPersisted();

        assertThat(reader.read()).isNull();
        assertThat(reader.read()).isNull();
        verify(placesApiService, never()).searchNearby(any(RunContext.class), eq("restaurant"), eq("T2"));
        verify(placesApiService, never()).searchNearby(any(RunContext.class), eq("cafe"), any());
    }

    @Test
    void read_skipsRestOfCategoryAfterRepeatedTransientFailures() {
        RunContext runContext = new RunContext(47.0, -122.0, 1000, List.of("restaurant", "cafe"), 100);
        when(placesApiService.searchNearby(any(RunContext.class), eq("restaurant"), isNull()))
                .thenReturn(page("T2", "r1"));
        when(placesApiService.searchNearby(any(RunContext.class), eq("restaurant"), eq("T2")))
                .thenThrow(new TransientProviderException("google-places", "INVALID_REQUEST"));
        when(placesApiService.searchNearby(any(RunContext.class), eq("cafe"), isNull()))
                .thenReturn(page(null, "c1"));

        assertThat(drain(reader(runContext))).containsExactly("r1", "c1");
        verify(placesApiService, times(3)).searchNearby(any(RunContext.class), eq("restaurant"), eq("T2"));
    }

    @Test
    void read_propagatesAuthenticationFailure() {
        RunContext runContext = new RunContext(47.0, -122.0, 1000, List.of("restaurant"), 100);
        when(placesApiService.searchNearby(any(RunContext.class), eq("restaurant"), isNull()))
                .thenThrow(new ProviderAuthenticationException("google-places", "REQUEST_DENIED"));

        CategorySearchReader reader = reader(runContext);

        assertThatThrownBy(reader::read).isInstanceOf(ProviderAuthenticationException.class);
    }
}
