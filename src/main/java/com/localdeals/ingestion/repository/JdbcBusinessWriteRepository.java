package com.localdeals.ingestion.repository;

import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.CanonicalBusiness;
import com.localdeals.ingestion.dto.ReviewItem;
import com.localdeals.ingestion.dto.ScrapedExtras;
import com.localdeals.ingestion.service.DealCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * PostgreSQL writes for businesses and their child rows
 */
@Repository
public class JdbcBusinessWriteRepository implements BusinessWriteRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcBusinessWriteRepository.class);

    static final String UPSERT_BUSINESS_SQL = """
            INSERT INTO businesses (
                google_place_id, yelp_id, name, category, address, lat, lon, phone, website,
                rating, rating_count, price_level, opening_hours, description, photo_path, maps_url,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, clock_timestamp(), clock_timestamp())
            ON CONFLICT (google_place_id) DO UPDATE SET
                yelp_id = EXCLUDED.yelp_id,
                name = EXCLUDED.name,
                category = EXCLUDED.category,
                address = EXCLUDED.address,
                lat = EXCLUDED.lat,
                lon = EXCLUDED.lon,
                phone = EXCLUDED.phone,
                website = EXCLUDED.website,
                rating = EXCLUDED.rating,
                rating_count = EXCLUDED.rating_count,
                price_level = EXCLUDED.price_level,
                opening_hours = EXCLUDED.opening_hours,
                description = EXCLUDED.description,
                photo_path = EXCLUDED.photo_path,
                maps_url = EXCLUDED.maps_url,
                updated_at = clock_timestamp()
            RETURNING id
            """;

    static final String INSERT_REVIEW_SQL = """
            INSERT INTO google_reviews (business_id, author_name, rating, text, relative_time, created_at)
            VALUES (?, ?, ?, ?, ?, now())
            """;

    static final String INSERT_DEAL_SQL = """
            INSERT INTO deals (business_id, title, description, start_date, end_date, created_at)
            VALUES (?, ?, ?, ?, ?, now())
            """;

    static final String UPSERT_EXTRAS_SQL = """
            INSERT INTO business_extras (business_id, description, menu_links, updated_at)
            VALUES (?, ?, ?, now())
            ON CONFLICT (business_id) DO UPDATE SET
                description = EXCLUDED.description,
                menu_links = EXCLUDED.menu_links,
                updated_at = now()
            """;

    private final JdbcTemplate jdbcTemplate;
    private final DealCatalog dealCatalog;
    private final Clock clock;

    public JdbcBusinessWriteRepository(JdbcTemplate jdbcTemplate, DealCatalog dealCatalog, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.dealCatalog = dealCatalog;
        this.clock = clock;
    }

    @Override
    public long upsertBusiness(CanonicalBusiness business) {
        Long id = jdbcTemplate.queryForObject(UPSERT_BUSINESS_SQL, Long.class,
                business.getExternalPrimaryId(),
                business.getExternalSecondaryId(),
                business.getName(),
                business.getCategory(),
                business.getAddress(),
                business.getLatitude(),
                business.getLongitude(),
                business.getPhone(),
                business.getWebsiteUrl(),
                business.getRating(),
                business.getRatingCount(),
                business.getPriceLevel(),
                business.getOpeningHours(),
                business.getDescription(),
                business.getPhotoPath(),
                business.getMapsUrl());

        if (id == null) {
            throw new IllegalStateException("Upsert returned no id for place " + business.getExternalPrimaryId());
        }
        logger.debug("  ✅ Upserted business: {} (ID: {})", business.getName(), id);
        return id;
    }

    @Override
    public int appendReviews(long businessId, List<ReviewItem> reviews) {
        if (reviews == null || reviews.isEmpty()) {
            return 0;
        }

        List<ReviewItem> capped = reviews.subList(0, Math.min(reviews.size(), MAX_REVIEWS));
        for (ReviewItem review : capped) {
            jdbcTemplate.update(INSERT_REVIEW_SQL,
                    businessId,
                    review.getAuthorName(),
                    review.getRating(),
                    review.getText(),
                    review.getRelativeTime());
        }
        return capped.size();
    }

    @Override
    public void appendOffer(long businessId, String category) {
        IngestionProperties.Offer offer = dealCatalog.offerFor(category);
        LocalDate startDate = LocalDate.now(clock);
        LocalDate endDate = startDate.plusDays(dealCatalog.getValidityDays());

        jdbcTemplate.update(INSERT_DEAL_SQL,
                businessId,
                offer.getTitle(),
                offer.getDescription(),
                startDate,
                endDate);
    }

    @Override
    public void upsertExtras(long businessId, ScrapedExtras extras) {
        List<String> links = extras.getMenuLinks();
        String[] menuLinks = links.subList(0, Math.min(links.size(), MAX_MENU_LINKS)).toArray(new String[0]);

        jdbcTemplate.update(UPSERT_EXTRAS_SQL,
                businessId,
                extras.getDescription(),
                menuLinks);
    }
}
