package io.trading.adapter.model;

/**
 * Unit of a trailing stop offset.
 */
public enum TrailingOffsetType {
    PRICE,
    BASIS_POINTS,
    TICKS
}
