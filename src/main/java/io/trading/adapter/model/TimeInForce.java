package io.trading.adapter.model;

/**
 * Venue-agnostic time in force.
 */
public enum TimeInForce {
    GTC,
    IOC,
    FOK,
    GTD,
    DAY,
    AT_THE_OPEN,
    AT_THE_CLOSE
}
