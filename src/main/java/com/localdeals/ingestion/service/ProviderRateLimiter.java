package com.localdeals.ingestion.service;

import com.localdeals.ingestion.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Keeps a minimum gap between consecutive calls on the same channel and
 * provides the fixed pauses used for page tokens and detail retries.
 * All callers run on the single batch thread.
 */
@Component
public class ProviderRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(ProviderRateLimiter.class);

    private final Map<ProviderChannel, Duration> minIntervals = new EnumMap<>(ProviderChannel.class);
    private final Map<ProviderChannel, Instant> lastCalls = new EnumMap<>(ProviderChannel.class);
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public ProviderRateLimiter(IngestionProperties properties, Clock clock) {
        this(Map.of(
                ProviderChannel.PRIMARY, properties.getPrimary().getMinInterval(),
                ProviderChannel.SECONDARY, properties.getSecondary().getMinInterval(),
                ProviderChannel.WEBSITE, properties.getScraper().getMinInterval()
        ), clock, Sleeper.threadSleeper());
    }

    public ProviderRateLimiter(Map<ProviderChannel, Duration> minIntervals, Clock clock, Sleeper sleeper) {
        this.minIntervals.putAll(minIntervals);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the channel's minimum interval since its previous call has elapsed, then claims the slot.
     */
    public void acquire(ProviderChannel channel) {
        Duration interval = minIntervals.getOrDefault(channel, Duration.ZERO);
        Instant last = lastCalls.get(channel);

        if (last != null && !interval.isZero()) {
            Duration wait = Duration.between(clock.instant(), last.plus(interval));
            if (!wait.isNegative() && !wait.isZero()) {
                logger.trace("Throttling {} for {}ms", channel, wait.toMillis());
                pause(wait);
            }
        }

        lastCalls.put(channel, clock.instant());
    }

    /**
     * Fixed delay, used between pagination calls, between categories and between detail retries.
     */
    public void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Rate limit delay interrupted");
        }
    }
}
