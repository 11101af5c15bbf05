package io.trading.adapter.model;

/**
 * Currency (or crypto asset) definition.
 *
 * @param code         Asset code (e.g., "BTC")
 * @param precision    Number of decimal places the venue reports for the asset
 * @param currencyType Crypto or fiat
 */
public record Currency(
    String code,
    int precision,
    CurrencyType currencyType
) {
    public Currency {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (precision < 0) {
            throw new IllegalArgumentException("precision cannot be negative");
        }
        if (currencyType == null) {
            throw new IllegalArgumentException("currencyType cannot be null");
        }
    }

    public static Currency of(String code, int precision) {
        return new Currency(code, precision, CurrencyType.forCode(code));
    }

    @Override
    public String toString() {
        return code;
    }
}
