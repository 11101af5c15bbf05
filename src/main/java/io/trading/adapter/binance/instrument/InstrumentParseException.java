package io.trading.adapter.binance.instrument;

/**
 * Thrown when the venue data for a single symbol cannot be turned into an instrument.
 * Recovered per symbol: the symbol is skipped and the load continues.
 */
public class InstrumentParseException extends RuntimeException {

    public InstrumentParseException(String message) {
        super(message);
    }

    public InstrumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
