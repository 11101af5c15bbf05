package io.trading.adapter.binance.common;

import io.trading.adapter.model.Symbol;

/**
 * A symbol in Binance wire form (e.g., "BTCUSDT", "BTCUSD_PERP", "ETHUSDT_240628").
 */
public final class BinanceSymbol {

    private static final String PERP_SUFFIX = "-PERP";
    private static final String COIN_PERP_SUFFIX = "_PERP";

    private final String value;

    private BinanceSymbol(String value) {
        this.value = value;
    }

    /**
     * Converts a canonical or loosely formatted symbol to its wire form.
     *
     * "btc/usdt" becomes "BTCUSDT" and "BTCUSDT-PERP" becomes "BTCUSDT". On COIN_FUTURE accounts
     * "BTCUSD-PERP" becomes "BTCUSD_PERP".
     *
     * @throws IllegalArgumentException if the symbol is null or empty after normalization
     */
    public static BinanceSymbol of(String raw, BinanceAccountType accountType) {
        if (raw == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        String normalized = raw.toUpperCase()
            .replaceAll("\\s+", "")
            .replace("/", "");
        if (normalized.endsWith(PERP_SUFFIX)) {
            String root = normalized.substring(0, normalized.length() - PERP_SUFFIX.length());
            normalized = accountType == BinanceAccountType.COIN_FUTURE ? root + COIN_PERP_SUFFIX : root;
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be empty: '" + raw + "'");
        }
        return new BinanceSymbol(normalized);
    }

    public String getValue() {
        return value;
    }

    /**
     * Converts the wire symbol to the canonical internal symbol.
     *
     * Spot and margin symbols are unchanged. Derivative symbols ending in a digit are dated
     * contracts and stay unchanged; every other derivative symbol is a perpetual and gains
     * the "-PERP" suffix.
     */
    public Symbol toInternal(BinanceAccountType accountType) {
        if (accountType.isSpotOrMargin()) {
            return new Symbol(value);
        }
        if (Character.isDigit(value.charAt(value.length() - 1))) {
            return new Symbol(value);
        }
        if (value.endsWith(COIN_PERP_SUFFIX)) {
            return new Symbol(value.substring(0, value.length() - COIN_PERP_SUFFIX.length()) + PERP_SUFFIX);
        }
        return new Symbol(value + PERP_SUFFIX);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof BinanceSymbol other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
