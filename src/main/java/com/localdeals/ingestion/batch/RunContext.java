package com.localdeals.ingestion.batch;

import com.localdeals.ingestion.config.IngestionProperties;
import com.localdeals.ingestion.exception.IngestionConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one ingestion run: search area, category order, target count,
 * the ids seen so far and the number of businesses upserted.
 * Created once per job execution.
 */
public class RunContext {

    private final double centerLatitude;
    private final double centerLongitude;
    private final int radiusMeters;
    private final List<String> categories;
    private final int targetCount;

    private final Set<String> seenPlaceIds = new HashSet<>();
    private final AtomicInteger persistedCount = new AtomicInteger(0);

    public RunContext(double centerLatitude, double centerLongitude, int radiusMeters,
                      List<String> categories, int targetCount) {
        if (categories == null || categories.isEmpty()) {
            throw new IngestionConfigurationException("ingestion.categories must list at least one category");
        }
        if (targetCount <= 0) {
            throw new IngestionConfigurationException("ingestion.target-count must be positive, was " + targetCount);
        }
        if (radiusMeters <= 0) {
            throw new IngestionConfigurationException("ingestion.radius-meters must be positive, was " + radiusMeters);
        }
        this.centerLatitude = centerLatitude;
        this.centerLongitude = centerLongitude;
        this.radiusMeters = radiusMeters;
        this.categories = List.copyOf(categories);
        this.targetCount = targetCount;
    }

    public static RunContext from(IngestionProperties properties) {
        return new RunContext(
                properties.getCenterLatitude(),
                properties.getCenterLongitude(),
                properties.getRadiusMeters(),
                properties.getCategories(),
                properties.getTargetCount());
    }

    public double getCenterLatitude() { return centerLatitude; }
    public double getCenterLongitude() { return centerLongitude; }
    public int getRadiusMeters() { return radiusMeters; }
    public List<String> getCategories() { return categories; }
    public int getTargetCount() { return targetCount; }

    /**
     * @return true if the id had not been seen in this run
     */
    public boolean markSeen(String placeId) {
        return seenPlaceIds.add(placeId);
    }

    public int getSeenCount() {
        return seenPlaceIds.size();
    }

    public int recordPersisted() {
        return persistedCount.incrementAndGet();
    }

    public int getPersistedCount() {
        return persistedCount.get();
    }

    public boolean isTargetReached() {
        return persistedCount.get() >= targetCount;
    }

    @Override
    public String toString() {
        return String.format("RunContext{center=%s,%s, radius=%dm, categories=%s, target=%d, persisted=%d}",
                centerLatitude, centerLongitude, radiusMeters, categories, targetCount, persistedCount.get());
    }
}
