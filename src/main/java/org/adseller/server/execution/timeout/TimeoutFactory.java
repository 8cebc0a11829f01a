package org.adseller.server.execution.timeout;

import java.time.Clock;
import java.util.Objects;

public class TimeoutFactory {

    private final Clock clock;

    public TimeoutFactory(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Returns a {@link Timeout} expiring {@code timeoutMillis} after the current moment.
     */
    public Timeout create(long timeoutMillis) {
        if (timeoutMillis < 1) {
            throw new IllegalArgumentException("Timeout must be positive, but was " + timeoutMillis);
        }

        return new Timeout(clock, clock.millis() + timeoutMillis);
    }
}
