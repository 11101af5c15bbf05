package io.trading.adapter.model;

/**
 * Lifecycle status of an order as seen by the trading core.
 */
public enum OrderStatus {
    SUBMITTED,
    ACCEPTED,
    REJECTED,
    CANCELED,
    EXPIRED,
    TRIGGERED,
    PENDING_CANCEL,
    PARTIALLY_FILLED,
    FILLED;

    /**
     * Returns whether no further state transition is possible from this status.
     */
    public boolean isTerminal() {
        return switch (this) {
            case REJECTED, CANCELED, EXPIRED, FILLED -> true;
            default -> false;
        };
    }

    /**
     * Returns whether the order is still working at the venue.
     */
    public boolean isOpen() {
        return switch (this) {
            case ACCEPTED, TRIGGERED, PENDING_CANCEL, PARTIALLY_FILLED -> true;
            default -> false;
        };
    }
}
