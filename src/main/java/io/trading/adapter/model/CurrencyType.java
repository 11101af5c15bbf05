package io.trading.adapter.model;

import java.util.Set;

/**
 * Currency classification.
 */
public enum CurrencyType {
    CRYPTO,
    FIAT;

    private static final Set<String> FIAT_CODES = Set.of(
        "USD", "EUR", "GBP", "AUD", "BRL", "TRY", "RUB", "UAH", "NGN", "ZAR",
        "JPY", "ARS", "PLN", "RON", "MXN", "COP", "CZK", "IDR", "KZT"
    );

    /**
     * Classifies a currency code; anything not a known fiat code is treated as crypto.
     */
    public static CurrencyType forCode(String code) {
        return FIAT_CODES.contains(code) ? FIAT : CRYPTO;
    }
}
