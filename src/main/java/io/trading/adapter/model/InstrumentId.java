package io.trading.adapter.model;

/**
 * Instrument identifier, rendered as "SYMBOL.VENUE" (e.g., "ETHUSDT-PERP.BINANCE").
 *
 * @param symbol Canonical symbol
 * @param venue  Venue the instrument trades on
 */
public record InstrumentId(Symbol symbol, Venue venue) {
    public InstrumentId {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
    }

    public static InstrumentId of(String symbol, Venue venue) {
        return new InstrumentId(new Symbol(symbol), venue);
    }

    /**
     * Parses an identifier of the form "SYMBOL.VENUE".
     * The split happens at the last dot so symbols may not contain one.
     */
    public static InstrumentId fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("instrument id cannot be null");
        }
        int dot = value.lastIndexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException("Invalid instrument id format: " + value);
        }
        return new InstrumentId(new Symbol(value.substring(0, dot)), Venue.fromCode(value.substring(dot + 1)));
    }

    @Override
    public String toString() {
        return symbol.value() + "." + venue.getCode();
    }
}
