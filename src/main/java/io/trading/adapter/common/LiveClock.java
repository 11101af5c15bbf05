package io.trading.adapter.common;

import java.time.Instant;

/**
 * Wall clock backed by the system time.
 */
public class LiveClock implements Clock {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    @Override
    public long timestampNs() {
        Instant now = Instant.now();
        return now.getEpochSecond() * NANOS_PER_SECOND + now.getNano();
    }
}
