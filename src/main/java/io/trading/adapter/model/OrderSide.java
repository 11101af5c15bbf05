package io.trading.adapter.model;

/**
 * Order side (buy or sell).
 */
public enum OrderSide {
    NO_ORDER_SIDE,
    BUY,
    SELL;

    public static OrderSide fromString(String value) {
        if (value == null) {
            return NO_ORDER_SIDE;
        }
        return switch (value.toLowerCase()) {
            case "buy", "b" -> BUY;
            case "sell", "s" -> SELL;
            default -> NO_ORDER_SIDE;
        };
    }

    public OrderSide opposite() {
        return switch (this) {
            case BUY -> SELL;
            case SELL -> BUY;
            case NO_ORDER_SIDE -> NO_ORDER_SIDE;
        };
    }
}
