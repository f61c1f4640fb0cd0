package com.localdeals.ingestion.batch.reader;

import com.localdeals.ingestion.batch.RunContext;
import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.dto.PlaceSearchPage;
import com.localdeals.ingestion.dto.PlaceSearchResult;
import com.localdeals.ingestion.exception.TransientProviderException;
import com.localdeals.ingestion.service.GooglePlacesApiService;
import com.localdeals.ingestion.service.ProviderRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ItemReader;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Walks the configured categories in order and pages through the nearby search for each.
 * Emits every place id at most once per run and stops once the run's target is reached.
 */
public class CategorySearchReader implements ItemReader<PlaceSearchResult> {

    private static final Logger logger = LoggerFactory.getLogger(CategorySearchReader.class);

    private final GooglePlacesApiService googlePlacesApiService;
    private final ProviderRateLimiter rateLimiter;
    private final RunContext runContext;

    private final Duration pageTokenDelay;
    private final Duration categoryDelay;
    private final int searchAttempts;

    private final Deque<PlaceSearchResult> buffer = new ArrayDeque<>();
    private int categoryIndex = 0;
    private String currentCategory;
    private String nextPageToken;
    private int pageNumber;
    private boolean finished = false;

    public CategorySearchReader(GooglePlacesApiService googlePlacesApiService,
                                ProviderRateLimiter rateLimiter,
                                RunContext runContext,
                                IngestionProperties properties) {
        this.googlePlacesApiService = googlePlacesApiService;
        this.rateLimiter = rateLimiter;
        this.runContext = runContext;
        this.pageTokenDelay = properties.getPrimary().getPageTokenDelay();
        this.categoryDelay = properties.getCategoryDelay();
        this.searchAttempts = Math.max(1, properties.getPrimary().getSearchAttempts());
    }

    @Override
    public PlaceSearchResult read() {
        while (!finished) {
            if (runContext.isTargetReached()) {
                logger.info("🎯 Target of {} businesses reached, stopping search", runContext.getTargetCount());
                finish();
                return null;
            }

            if (!buffer.isEmpty()) {
                PlaceSearchResult candidate = buffer.poll();
                if (!runContext.markSeen(candidate.getPlaceId())) {
                    logger.debug("Skipping duplicate place {} ({})", candidate.getPlaceId(), candidate.getName());
                    continue;
                }
                logger.debug("📖 Reading place {} '{}' from '{}'", candidate.getPlaceId(), candidate.getName(), currentCategory);
                return candidate;
            }

            if (nextPageToken != null) {
                rateLimiter.pause(pageTokenDelay);
                loadPage(nextPageToken);
                continue;
            }

            if (!startNextCategory()) {
                logger.info("✅ All {} categories searched, {} unique places seen",
                        runContext.getCategories().size(), runContext.getSeenCount());
                finish();
                return null;
            }
        }
        return null;
    }

    private boolean startNextCategory() {
        List<String> categories = runContext.getCategories();
        if (categoryIndex >= categories.size()) {
            return false;
        }
        if (categoryIndex > 0) {
            rateLimiter.pause(categoryDelay);
        }

        currentCategory = categories.get(categoryIndex++);
        pageNumber = 0;
        logger.info("🔍 Searching category '{}' ({}/{}), persisted so far: {}/{}",
                currentCategory, categoryIndex, categories.size(),
                runContext.getPersistedCount(), runContext.getTargetCount());
        loadPage(null);
        return true;
    }

    private void loadPage(String pageToken) {
        nextPageToken = null;
        PlaceSearchPage page = searchWithRetry(pageToken);
        if (page == null) {
            logger.warn("⚠️ Skipping rest of category '{}' after {} failed search attempts",
                    currentCategory, searchAttempts);
            return;
        }

        pageNumber++;
        buffer.addAll(page.getResults());
        nextPageToken = page.hasNextPage() ? page.getNextPageToken() : null;
        logger.info("📄 Category '{}' page {}: {} results{}", currentCategory, pageNumber,
                page.getResults().size(), nextPageToken != null ? ", more pages available" : "");
    }

    private PlaceSearchPage searchWithRetry(String pageToken) {
        for (int attempt = 1; attempt <= searchAttempts; attempt++) {
            try {
                return googlePlacesApiService.searchNearby(runContext, currentCategory, pageToken);
            } catch (TransientProviderException e) {
                logger.warn("{} search for '{}' failed (attempt {}/{}): {}",
                        e.getProvider(), currentCategory, attempt, searchAttempts, e.getMessage());
                if (attempt < searchAttempts) {
                    rateLimiter.pause(pageTokenDelay);
                }
            }
        }
        return null;
    }

    private void finish() {
        finished = true;
        buffer.clear();
        nextPageToken = null;
    }
}
