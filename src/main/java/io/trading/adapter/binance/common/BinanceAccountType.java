package io.trading.adapter.binance.common;

/**
 * Binance account (product) types. Selects the enum tables, symbol conventions and
 * filter sets in force.
 */
public enum BinanceAccountType {
    SPOT("SPOT"),
    MARGIN("MARGIN"),
    ISOLATED_MARGIN("ISOLATED_MARGIN"),
    USDT_FUTURE("USDT_FUTURE"),
    COIN_FUTURE("COIN_FUTURE"),
    PORTFOLIO_MARGIN("PORTFOLIO_MARGIN");

    private final String displayName;

    BinanceAccountType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isSpot() {
        return this == SPOT;
    }

    public boolean isMargin() {
        return this == MARGIN || this == ISOLATED_MARGIN;
    }

    public boolean isSpotOrMargin() {
        return isSpot() || isMargin();
    }

    /**
     * Returns whether the account trades derivatives (USD-M, COIN-M or portfolio margin).
     */
    public boolean isFutures() {
        return this == USDT_FUTURE || this == COIN_FUTURE || this == PORTFOLIO_MARGIN;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
