package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Execution type of a user data stream order update. CALCULATED marks a liquidation fill.
 */
public enum BinanceExecutionType {
    NEW("NEW"),
    CANCELED("CANCELED"),
    REPLACED("REPLACED"),
    REJECTED("REJECTED"),
    TRADE("TRADE"),
    EXPIRED("EXPIRED"),
    CALCULATED("CALCULATED"),
    AMENDMENT("AMENDMENT"),
    TRADE_PREVENTION("TRADE_PREVENTION");

    private static final Map<String, BinanceExecutionType> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceExecutionType::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceExecutionType(String wireValue) {
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
    public static BinanceExecutionType fromWire(String value) {
        BinanceExecutionType result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceExecutionType", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
