package io.trading.adapter.model;

/**
 * Whether a fill added or removed liquidity.
 */
public enum LiquiditySide {
    NO_LIQUIDITY_SIDE,
    MAKER,
    TAKER;

    public static LiquiditySide fromMakerFlag(boolean isMaker) {
        return isMaker ? MAKER : TAKER;
    }
}
