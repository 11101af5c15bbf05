package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Futures contract type. Pending listings report an empty contract type.
 */
public enum BinanceFuturesContractType {
    PERPETUAL("PERPETUAL"),
    CURRENT_MONTH("CURRENT_MONTH"),
    NEXT_MONTH("NEXT_MONTH"),
    CURRENT_QUARTER("CURRENT_QUARTER"),
    NEXT_QUARTER("NEXT_QUARTER"),
    PERPETUAL_DELIVERING("PERPETUAL_DELIVERING"),
    CURRENT_QUARTER_DELIVERING("CURRENT_QUARTER_DELIVERING");

    private static final Map<String, BinanceFuturesContractType> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceFuturesContractType::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceFuturesContractType(String wireValue) {
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
    public static BinanceFuturesContractType fromWire(String value) {
        BinanceFuturesContractType result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceFuturesContractType", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
