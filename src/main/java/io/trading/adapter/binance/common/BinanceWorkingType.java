package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Price source that triggers a futures conditional order.
 */
public enum BinanceWorkingType {
    CONTRACT_PRICE("CONTRACT_PRICE"),
    MARK_PRICE("MARK_PRICE");

    private static final Map<String, BinanceWorkingType> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceWorkingType::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceWorkingType(String wireValue) {
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
    public static BinanceWorkingType fromWire(String value) {
        BinanceWorkingType result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceWorkingType", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
