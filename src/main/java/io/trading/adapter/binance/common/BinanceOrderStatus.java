package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binance order status.
 *
 * EXPIRED_IN_MATCH is an expiry caused by self-trade prevention.
 * NEW_INSURANCE and NEW_ADL are liquidation and auto-deleverage fills.
 */
public enum BinanceOrderStatus {
    NEW("NEW"),
    PENDING_NEW("PENDING_NEW"),
    PARTIALLY_FILLED("PARTIALLY_FILLED"),
    FILLED("FILLED"),
    CANCELED("CANCELED"),
    PENDING_CANCEL("PENDING_CANCEL"),
    REJECTED("REJECTED"),
    EXPIRED("EXPIRED"),
    EXPIRED_IN_MATCH("EXPIRED_IN_MATCH"),
    NEW_INSURANCE("NEW_INSURANCE"),
    NEW_ADL("NEW_ADL");

    private static final Map<String, BinanceOrderStatus> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceOrderStatus::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceOrderStatus(String wireValue) {
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
    public static BinanceOrderStatus fromWire(String value) {
        BinanceOrderStatus result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceOrderStatus", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
