package io.trading.adapter.common;

/**
 * Source of the current time.
 */
public interface Clock {

    /**
     * Returns the current UNIX time in nanoseconds.
     */
    long timestampNs();

    /**
     * Returns the current UNIX time in milliseconds.
     */
    default long timestampMs() {
        return timestampNs() / 1_000_000L;
    }
}
