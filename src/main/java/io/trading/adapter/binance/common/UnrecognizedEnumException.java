package io.trading.adapter.binance.common;

/**
 * Thrown when a venue value has no registered internal mapping.
 * Indicates the venue introduced an undocumented value.
 */
public class UnrecognizedEnumException extends RuntimeException {

    private final String enumName;
    private final String rawValue;

    public UnrecognizedEnumException(String enumName, String rawValue) {
        super(String.format("Unrecognized %s value '%s'", enumName, rawValue));
        this.enumName = enumName;
        this.rawValue = rawValue;
    }

    public UnrecognizedEnumException(String enumName, String rawValue, BinanceAccountType accountType) {
        super(String.format("Unrecognized %s value '%s' for %s", enumName, rawValue, accountType));
        this.enumName = enumName;
        this.rawValue = rawValue;
    }

    public String getEnumName() {
        return enumName;
    }

    public String getRawValue() {
        return rawValue;
    }
}
