package com.localdeals.ingestion.repository;

import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.CanonicalBusiness;
import com.localdeals.ingestion.dto.ReviewItem;
import com.localdeals.ingestion.dto.ScrapedExtras;
import com.localdeals.ingestion.service.DealCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcBusinessWriteRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcBusinessWriteRepository repository;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        properties.getDeals().setOffers(Map.of("cafe", new IngestionProperties.Offer("Free Pastry", "With any coffee")));
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        repository = new JdbcBusinessWriteRepository(jdbcTemplate, new DealCatalog(properties), clock);
    }

    @Test
    void upsertBusiness_usesOnConflictAndReturnsId() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(42L);

        CanonicalBusiness business = CanonicalBusiness.builder()
                .externalPrimaryId("place-1")
                .name("Cafe One")
                .phone("N/A")
                .websiteUrl("N/A")
                .photoPath("photo-cache/placeholder.png")
                .build();

        long id = repository.upsertBusiness(business);

        assertThat(id).isEqualTo(42L);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).queryForObject(sql.capture(), eq(Long.class), any(Object[].class));
        assertThat(sql.getValue())
                .contains("ON CONFLICT (google_place_id) DO UPDATE")
                .contains("updated_at = clock_timestamp()")
                .contains("RETURNING id");
    }

    @Test
    void upsertBusiness_conflictUpdatesEveryMutableColumn() {
        String sql = JdbcBusinessWriteRepository.UPSERT_BUSINESS_SQL;
        String columnList = sql.substring(sql.indexOf('(') + 1, sql.indexOf(')'));
        List<String> columns = Arrays.stream(columnList.split(","))
                .map(String::trim)
                .collect(Collectors.toList());
        String updateClause = sql.substring(sql.indexOf("DO UPDATE SET"));

        assertThat(columns).contains("google_place_id", "name", "opening_hours", "updated_at");
        for (String column : columns) {
            if (column.equals("google_place_id") || column.equals("created_at")) {
                assertThat(updateClause).doesNotContain(column + " =");
            } else if (column.equals("updated_at")) {
                assertThat(updateClause).contains("updated_at = clock_timestamp()");
            } else {
                assertThat(updateClause).contains(column + " = EXCLUDED." + column);
            }
        }
    }

    @Test
    void upsertBusiness_withoutReturnedIdFails() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(null);

        CanonicalBusiness business = CanonicalBusiness.builder().externalPrimaryId("place-1").build();

        assertThatThrownBy(() -> repository.upsertBusiness(business))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("place-1");
    }

    @Test
    void appendReviews_writesAtMostFiveInOrder() {
        List<ReviewItem> reviews = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            reviews.add(ReviewItem.builder().authorName("author-" + i).rating(5).text("text " + i).build());
        }

        int written = repository.appendReviews(7L, reviews);

        assertThat(written).isEqualTo(5);
        ArgumentCaptor<Object> author = ArgumentCaptor.forClass(Object.class);
        verify(jdbcTemplate, times(5)).update(eq(JdbcBusinessWriteRepository.INSERT_REVIEW_SQL),
                eq(7L), author.capture(), any(), any(), any());
        assertThat(author.getAllValues()).containsExactly("author-1", "author-2", "author-3", "author-4", "author-5");
    }

    @Test
    void appendReviews_emptyListWritesNothing() {
        assertThat(repository.appendReviews(7L, List.of())).isZero();
        assertThat(repository.appendReviews(7L, null)).isZero();
    }

    @Test
    void appendOffer_usesCategoryOfferAndThirtyDayWindow() {
        repository.appendOffer(3L, "Cafe");

        verify(jdbcTemplate).update(JdbcBusinessWriteRepository.INSERT_DEAL_SQL,
                3L, "Free Pastry", "With any coffee",
                LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31));
    }

    @Test
    void appendOffer_unknownCategoryUsesFallbackOffer() {
        repository.appendOffer(3L, "laundry");

        verify(jdbcTemplate).update(eq(JdbcBusinessWriteRepository.INSERT_DEAL_SQL),
                eq(3L), eq("Local Favorite"), any(), eq(LocalDate.of(2024, 5, 1)), eq(LocalDate.of(2024, 5, 31)));
    }

    @Test
    void upsertExtras_capsMenuLinksAtThree() {
        ScrapedExtras extras = new ScrapedExtras("Fresh bread daily",
                List.of("https://a.example/menu", "https://a.example/menu/lunch",
                        "https://a.example/menu/dinner", "https://a.example/menu/drinks"));

        repository.upsertExtras(9L, extras);

        ArgumentCaptor<String[]> links = ArgumentCaptor.forClass(String[].class);
        verify(jdbcTemplate).update(eq(JdbcBusinessWriteRepository.UPSERT_EXTRAS_SQL),
                eq(9L), eq("Fresh bread daily"), links.capture());
        assertThat(links.getValue()).containsExactly(
                "https://a.example/menu", "https://a.example/menu/lunch", "https://a.example/menu/dinner");
        assertThat(JdbcBusinessWriteRepository.UPSERT_EXTRAS_SQL).contains("ON CONFLICT (business_id) DO UPDATE");
    }
}
