package org.adseller.server.execution.timeout;

import lombok.Getter;

import java.time.Clock;

/**
 * Single deadline shared by every external lookup made while a proposal is negotiated.
 */
public class Timeout {

    private final Clock clock;

    @Getter
    private final long deadline;

    Timeout(Clock clock, long deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Returns amount of milliseconds left before this {@link Timeout} expires, never negative.
     */
    public long remaining() {
        return Math.max(deadline - clock.millis(), 0);
    }

    public boolean isExpired() {
        return remaining() == 0;
    }
}
