package io.trading.adapter.model;

/**
 * Venue-independent instrument symbol (e.g., "BTCUSDT", "BTCUSDT-PERP", "BTCUSD_240628").
 *
 * @param value Canonical symbol text
 */
public record Symbol(String value) {
    public Symbol {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
