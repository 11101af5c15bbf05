package io.trading.adapter.model;

/**
 * Venue-agnostic order types.
 */
public enum OrderType {
    MARKET,
    LIMIT,
    STOP_MARKET,
    STOP_LIMIT,
    MARKET_TO_LIMIT,
    MARKET_IF_TOUCHED,
    LIMIT_IF_TOUCHED,
    TRAILING_STOP_MARKET,
    TRAILING_STOP_LIMIT;

    /**
     * Returns whether orders of this type carry a limit price.
     */
    public boolean hasPrice() {
        return switch (this) {
            case LIMIT, STOP_LIMIT, LIMIT_IF_TOUCHED, TRAILING_STOP_LIMIT -> true;
            default -> false;
        };
    }

    /**
     * Returns whether orders of this type carry a trigger price.
     */
    public boolean hasTriggerPrice() {
        return switch (this) {
            case STOP_MARKET, STOP_LIMIT, MARKET_IF_TOUCHED, LIMIT_IF_TOUCHED -> true;
            default -> false;
        };
    }
}
