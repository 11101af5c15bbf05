package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Futures position side. BOTH is used in one-way mode.
 */
public enum BinancePositionSide {
    BOTH("BOTH"),
    LONG("LONG"),
    SHORT("SHORT");

    private static final Map<String, BinancePositionSide> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinancePositionSide::getWireValue, Function.identity()));

    private final String wireValue;

    BinancePositionSide(String wireValue) {
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
    public static BinancePositionSide fromWire(String value) {
        BinancePositionSide result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinancePositionSide", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
