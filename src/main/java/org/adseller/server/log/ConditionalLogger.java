package org.adseller.server.log;

import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rate-limited logging for messages that may repeat on every proposal, e.g. degraded audience lookups.
 */
public class ConditionalLogger {

    private static final int CACHE_MAXIMUM_SIZE = 10_000;
    private static final int EXPIRE_CACHE_DURATION_HOURS = 1;

    private final Logger logger;

    private final ConcurrentMap<String, AtomicInteger> messageToCount;

    public ConditionalLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger);

        messageToCount = Caffeine.newBuilder()
                .maximumSize(CACHE_MAXIMUM_SIZE)
                .expireAfterWrite(EXPIRE_CACHE_DURATION_HOURS, TimeUnit.HOURS)
                .<String, AtomicInteger>build()
                .asMap();
    }

    /**
     * Logs every {@code limit}-th occurrence of the message.
     */
    public void warn(String message, int limit) {
        final AtomicInteger count = messageToCount.computeIfAbsent(message, ignored -> new AtomicInteger());
        if (count.incrementAndGet() >= limit) {
            count.set(0);
            logger.warn(message);
        }
    }
}
