package com.localdeals.ingestion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run parameters and provider tuning, loaded once at startup from {@code ingestion.*}.
 */
@Data
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    /**
     * Search center. Defaults to Bothell, WA.
     */
    private double centerLatitude = 47.7599;
    private double centerLongitude = -122.2050;

    private int radiusMeters = 3000;

    /**
     * Run stops once this many businesses have been upserted.
     */
    private int targetCount = 200;

    /**
     * Google place types, visited in this order.
     */
    private List<String> categories = List.of("restaurant", "cafe", "bakery", "bar", "meal_takeaway");

    private Duration categoryDelay = Duration.ofSeconds(1);

    private Primary primary = new Primary();
    private Secondary secondary = new Secondary();
    private Scraper scraper = new Scraper();
    private Photos photos = new Photos();
    private Deals deals = new Deals();

    @Data
    public static class Primary {
        private Duration minInterval = Duration.ofMillis(200);

        /**
         * A next_page_token is rejected until it has been live for roughly two seconds.
         */
        private Duration pageTokenDelay = Duration.ofSeconds(2);

        private int searchAttempts = 3;
        private int detailAttempts = 3;
        private Duration detailRetryDelay = Duration.ofSeconds(1);

        private int transportRetries = 2;
        private Duration transportBackoff = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Secondary {
        private Duration minInterval = Duration.ofMillis(250);
        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Scraper {
        private Duration timeout = Duration.ofSeconds(6);
        private Duration minInterval = Duration.ofMillis(200);
        private String userAgent = "Mozilla/5.0 (compatible; LocalDealsBatch/1.0)";
    }

    @Data
    public static class Photos {
        private String cacheDir = "photo-cache";
        private String placeholderName = "placeholder.png";
        private int maxWidth = 800;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Deals {
        private int validityDays = 30;

        /**
         * Keyed by Google place type.
         */
        private Map<String, Offer> offers = new LinkedHashMap<>();

        private Offer fallback = new Offer("Local Favorite", "Show this app at the counter for a special welcome offer.");
    }

    @Data
    public static class Offer {
        private String title;
        private String description;

        public Offer() {
        }

        public Offer(String title, String description) {
            this.title = title;
            this.description = description;
        }
    }
}
