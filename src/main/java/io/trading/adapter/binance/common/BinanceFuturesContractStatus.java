package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Futures contract trading status.
 */
public enum BinanceFuturesContractStatus {
    PENDING_TRADING("PENDING_TRADING"),
    TRADING("TRADING"),
    PRE_DELIVERING("PRE_DELIVERING"),
    DELIVERING("DELIVERING"),
    DELIVERED("DELIVERED"),
    PRE_SETTLE("PRE_SETTLE"),
    SETTLING("SETTLING"),
    CLOSE("CLOSE");

    private static final Map<String, BinanceFuturesContractStatus> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceFuturesContractStatus::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceFuturesContractStatus(String wireValue) {
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
    public static BinanceFuturesContractStatus fromWire(String value) {
        BinanceFuturesContractStatus result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceFuturesContractStatus", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
