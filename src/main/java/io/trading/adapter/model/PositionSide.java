package io.trading.adapter.model;

/**
 * Side of a position. In hedge mode an order targets the LONG or SHORT leg explicitly.
 */
public enum PositionSide {
    FLAT,
    LONG,
    SHORT
}
