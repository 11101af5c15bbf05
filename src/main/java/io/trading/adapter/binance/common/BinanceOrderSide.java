package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binance order side.
 */
public enum BinanceOrderSide {
    BUY("BUY"),
    SELL("SELL");

    private static final Map<String, BinanceOrderSide> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceOrderSide::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceOrderSide(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolves a venue spelling.
     *
     * @throws UnrecognizedEnumException if the spelling is unknown
     */
    public static BinanceOrderSide fromWire(String value) {
        BinanceOrderSide result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceOrderSide", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
