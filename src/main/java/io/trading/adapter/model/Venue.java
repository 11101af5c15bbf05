package io.trading.adapter.model;

/**
 * Trading venues known to the adapter.
 */
public enum Venue {
    BINANCE("BINANCE"),
    OKX("OKX"),
    BYBIT("BYBIT");

    private final String code;

    Venue(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Venue fromCode(String code) {
        for (Venue venue : values()) {
            if (venue.code.equals(code)) {
                return venue;
            }
        }
        throw new IllegalArgumentException("Unknown venue: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
