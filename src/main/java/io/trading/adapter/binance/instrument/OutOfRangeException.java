package io.trading.adapter.binance.instrument;

/**
 * Thrown when a venue trading rule value falls outside the configured sanity bounds.
 */
public class OutOfRangeException extends InstrumentParseException {

    private final String field;
    private final String value;

    public OutOfRangeException(String field, String value, String constraint) {
        super(String.format("%s '%s' out of range: %s", field, value, constraint));
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
